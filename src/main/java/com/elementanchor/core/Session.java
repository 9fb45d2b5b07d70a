package com.elementanchor.core;

import com.elementanchor.driver.Driver;
import com.elementanchor.model.Locator;
import com.elementanchor.node.Document;
import com.elementanchor.node.ElementHandle;
import org.openqa.selenium.support.ui.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Entry point: binds one driver backend to one configuration and hands out element
 * handles rooted at the document.
 *
 * <pre>
 *   Session session = new Session(new SeleniumDriver(webDriver), AnchorConfig.fromEnvironment());
 *   ElementHandle name = session.find(Locator.css("#name"));
 *   name.set("Ada").sendKeys(Keys.TAB);
 * </pre>
 *
 * A Session and the handles it produces belong to a single flow of control and are
 * not safe for concurrent use.
 */
public class Session {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final Driver driver;
    private final AnchorConfig config;
    private final Synchronizer synchronizer;
    private final Document document;

    public Session(Driver driver) {
        this(driver, AnchorConfig.defaults());
    }

    public Session(Driver driver, AnchorConfig config) {
        this(driver, config, new Synchronizer(driver, config));
    }

    /** Uses the given clock and sleeper for retry timing. */
    public Session(Driver driver, AnchorConfig config, Clock clock, Sleeper sleeper) {
        this(driver, config, new Synchronizer(driver, config, clock, sleeper));
    }

    private Session(Driver driver, AnchorConfig config, Synchronizer synchronizer) {
        this.driver       = Objects.requireNonNull(driver, "driver must not be null");
        this.config       = Objects.requireNonNull(config, "config must not be null");
        this.synchronizer = synchronizer;
        this.document     = new Document(this);
        log.info("Session: started on driver '{}' — {}", driver.name(), config);
    }

    /**
     * Finds the single element matching the locator anywhere in the document,
     * waiting for it to appear. The returned handle is reloadable.
     *
     * @throws ElementNotFoundException  (as the cause of an {@link ElementTimeoutException}
     *                                   on waiting drivers) when nothing matches
     * @throws AmbiguousMatchException   when several elements match
     */
    public ElementHandle find(Locator locator) {
        return document.find(locator);
    }

    public Document document()          { return document; }
    public Driver getDriver()           { return driver; }
    public AnchorConfig getConfig()     { return config; }
    public Synchronizer synchronizer()  { return synchronizer; }
}
