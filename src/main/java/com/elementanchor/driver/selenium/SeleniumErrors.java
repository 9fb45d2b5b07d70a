package com.elementanchor.driver.selenium;

import com.elementanchor.driver.DriverErrorKind;
import com.elementanchor.driver.DriverException;
import com.elementanchor.model.Locator;
import org.openqa.selenium.By;
import org.openqa.selenium.ElementClickInterceptedException;
import org.openqa.selenium.ElementNotInteractableException;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.UnsupportedCommandException;
import org.openqa.selenium.WebDriverException;

import java.util.function.Supplier;

/**
 * Translates Selenium exceptions into tagged {@link DriverException}s and locators
 * into {@link By} instances.
 *
 * Order matters in {@link #classify}: Selenium's {@code InvalidSelectorException}
 * extends {@code NoSuchElementException}, and {@code ElementClickInterceptedException}
 * extends {@code ElementNotInteractableException}.
 */
final class SeleniumErrors {

    private SeleniumErrors() {}

    static <T> T call(Supplier<T> action) {
        try {
            return action.get();
        } catch (WebDriverException e) {
            throw translate(e);
        }
    }

    static void run(Runnable action) {
        try {
            action.run();
        } catch (WebDriverException e) {
            throw translate(e);
        }
    }

    /** The tagged equivalent of {@code e}, or {@code e} itself when it is not recognised. */
    static RuntimeException translate(WebDriverException e) {
        DriverErrorKind kind = classify(e);
        return kind == null ? e : new DriverException(kind, e.getMessage(), e);
    }

    static DriverErrorKind classify(WebDriverException e) {
        if (e instanceof StaleElementReferenceException)    return DriverErrorKind.STALE_REFERENCE;
        if (e instanceof InvalidSelectorException)          return DriverErrorKind.INVALID_SELECTOR;
        if (e instanceof NoSuchElementException)            return DriverErrorKind.ELEMENT_NOT_FOUND;
        if (e instanceof ElementClickInterceptedException)  return DriverErrorKind.CLICK_INTERCEPTED;
        if (e instanceof ElementNotInteractableException)   return DriverErrorKind.NOT_INTERACTABLE;
        if (e instanceof UnsupportedCommandException)       return DriverErrorKind.NOT_SUPPORTED;
        return null;
    }

    static By toBy(Locator locator) {
        String value = locator.getValue();
        switch (locator.getKind()) {
            case Locator.CSS:       return By.cssSelector(value);
            case Locator.XPATH:     return By.xpath(value);
            case Locator.ID:        return By.id(value);
            case Locator.NAME:      return By.name(value);
            case Locator.TAG:       return By.tagName(value);
            case Locator.CLASS:     return By.className(value);
            case Locator.LINK_TEXT: return By.linkText(value);
            default:
                throw new DriverException(DriverErrorKind.INVALID_SELECTOR,
                    "Selenium driver cannot resolve selector kind '" + locator.getKind() + "'");
        }
    }
}
