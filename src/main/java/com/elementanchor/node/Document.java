package com.elementanchor.node;

import com.elementanchor.core.Session;
import com.elementanchor.driver.NodeBinding;
import com.elementanchor.model.Locator;

import java.util.List;

/**
 * The document root. Top-level handles use it as their scope; it never goes stale.
 */
public final class Document extends Node {

    public Document(Session session) {
        super(session);
    }

    @Override
    List<NodeBinding> findBindings(Locator locator) {
        return session.getDriver().findAll(locator);
    }

    @Override
    Node reloadScope() {
        return this;
    }

    @Override
    public String toString() {
        return "#<Document driver=\"" + session.getDriver().name() + "\">";
    }
}
