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
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.UnsupportedCommandException;
import org.openqa.selenium.WebDriverException;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SeleniumErrorsTest {

    @DataProvider
    public Object[][] classified() {
        return new Object[][] {
            { new StaleElementReferenceException("stale"),           DriverErrorKind.STALE_REFERENCE },
            { new NoSuchElementException("missing"),                 DriverErrorKind.ELEMENT_NOT_FOUND },
            { new InvalidSelectorException("bad css"),               DriverErrorKind.INVALID_SELECTOR },
            { new ElementNotInteractableException("hidden"),         DriverErrorKind.NOT_INTERACTABLE },
            { new ElementClickInterceptedException("overlay"),       DriverErrorKind.CLICK_INTERCEPTED },
            { new UnsupportedCommandException("no such command"),    DriverErrorKind.NOT_SUPPORTED },
        };
    }

    @Test(dataProvider = "classified")
    public void knownSeleniumErrorsAreTagged(WebDriverException error, DriverErrorKind expected) {
        RuntimeException translated = SeleniumErrors.translate(error);

        assertThat(translated).isInstanceOf(DriverException.class).hasCause(error);
        assertThat(((DriverException) translated).getKind()).isEqualTo(expected);
    }

    @Test
    public void unknownSeleniumErrorsPassThroughUnchanged() {
        TimeoutException timeout = new TimeoutException("page load");

        assertThat(SeleniumErrors.translate(timeout)).isSameAs(timeout);
        assertThatThrownBy(() -> SeleniumErrors.run(() -> { throw timeout; })).isSameAs(timeout);
    }

    @Test
    public void callTranslatesThrownErrors() {
        assertThatThrownBy(() -> SeleniumErrors.call(() -> { throw new StaleElementReferenceException("gone"); }))
            .isInstanceOf(DriverException.class)
            .satisfies(e -> assertThat(((DriverException) e).getKind()).isEqualTo(DriverErrorKind.STALE_REFERENCE));
    }

    @Test
    public void locatorsMapToSeleniumBys() {
        assertThat(SeleniumErrors.toBy(Locator.css("#name"))).isEqualTo(By.cssSelector("#name"));
        assertThat(SeleniumErrors.toBy(Locator.xpath("//input"))).isEqualTo(By.xpath("//input"));
        assertThat(SeleniumErrors.toBy(Locator.id("name"))).isEqualTo(By.id("name"));
        assertThat(SeleniumErrors.toBy(Locator.of(Locator.NAME, "email"))).isEqualTo(By.name("email"));
        assertThat(SeleniumErrors.toBy(Locator.of(Locator.TAG, "li"))).isEqualTo(By.tagName("li"));
        assertThat(SeleniumErrors.toBy(Locator.of(Locator.CLASS, "item"))).isEqualTo(By.className("item"));
        assertThat(SeleniumErrors.toBy(Locator.of(Locator.LINK_TEXT, "Home"))).isEqualTo(By.linkText("Home"));
    }

    @Test
    public void unmappedLocatorKindIsInvalidSelector() {
        assertThatThrownBy(() -> SeleniumErrors.toBy(Locator.of(Locator.TEXT, "Sign up")))
            .isInstanceOf(DriverException.class)
            .satisfies(e -> assertThat(((DriverException) e).getKind()).isEqualTo(DriverErrorKind.INVALID_SELECTOR));
    }
}
