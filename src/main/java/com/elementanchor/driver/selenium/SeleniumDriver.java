package com.elementanchor.driver.selenium;

import com.elementanchor.driver.Driver;
import com.elementanchor.driver.DriverErrorKind;
import com.elementanchor.driver.NodeBinding;
import com.elementanchor.model.Locator;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Driver backend over a Selenium {@link WebDriver}.
 *
 * The browser mutates the page on its own schedule, so this backend asks for
 * waiting retries. Stale, missing, non-interactable and click-intercepted elements
 * all count as invalid references worth retrying.
 */
public class SeleniumDriver implements Driver {

    private static final Set<DriverErrorKind> INVALID_ELEMENT_ERRORS = Collections.unmodifiableSet(EnumSet.of(
        DriverErrorKind.STALE_REFERENCE,
        DriverErrorKind.ELEMENT_NOT_FOUND,
        DriverErrorKind.NOT_INTERACTABLE,
        DriverErrorKind.CLICK_INTERCEPTED
    ));

    private final WebDriver webDriver;

    public SeleniumDriver(WebDriver webDriver) {
        this.webDriver = Objects.requireNonNull(webDriver, "webDriver must not be null");
    }

    @Override
    public String name() {
        return "selenium";
    }

    @Override
    public List<NodeBinding> findAll(Locator locator) {
        List<WebElement> found = SeleniumErrors.call(() -> webDriver.findElements(SeleniumErrors.toBy(locator)));
        return bindAll(webDriver, found, locator);
    }

    @Override
    public Set<DriverErrorKind> invalidElementErrors() {
        return INVALID_ELEMENT_ERRORS;
    }

    @Override
    public boolean needsWaiting() {
        return true;
    }

    public WebDriver getWebDriver() {
        return webDriver;
    }

    static List<NodeBinding> bindAll(WebDriver webDriver, List<WebElement> elements, Locator locator) {
        List<NodeBinding> bindings = new ArrayList<>(elements.size());
        for (WebElement element : elements) {
            if (locator.isVisibleOnly() && !SeleniumErrors.call(element::isDisplayed)) continue;
            bindings.add(new SeleniumNodeBinding(webDriver, element));
        }
        return bindings;
    }
}
