package com.elementanchor.driver.selenium;

import com.elementanchor.driver.DriverErrorKind;
import com.elementanchor.driver.DriverException;
import com.elementanchor.driver.NodeBinding;
import com.elementanchor.driver.SupportsExtended;
import com.elementanchor.model.ClickOptions;
import com.elementanchor.model.Locator;
import com.elementanchor.model.Modifier;
import com.elementanchor.model.Operation;
import org.openqa.selenium.By;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.Keys;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.Actions;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Binding over one Selenium {@link WebElement}.
 *
 * Extended clicks are built as W3C action sequences: modifier keys are pressed before
 * the pointer moves and released after the click. Selenium measures pointer offsets
 * from the element's centre, so an offset given from the top-left corner is shifted
 * by half the element's size.
 *
 * Extended set understands one option, {@code clear}:
 *   - {@code "backspace"}: erase the current value one keystroke at a time, firing key
 *     events for each character
 *   - {@code "none"}: append to the current value
 *   - absent: the same as {@link #set(String)}
 */
@SupportsExtended({Operation.CLICK, Operation.RIGHT_CLICK, Operation.DOUBLE_CLICK, Operation.SET})
public class SeleniumNodeBinding implements NodeBinding {

    private static final String XPATH_SCRIPT =
        "var el = arguments[0]; var parts = [];"
        + "for (; el && el.nodeType === 1; el = el.parentNode) {"
        + "  var index = 0, count = 0;"
        + "  for (var sib = el.parentNode ? el.parentNode.firstChild : null; sib; sib = sib.nextSibling) {"
        + "    if (sib.nodeType === 1 && sib.tagName === el.tagName) { count++; if (sib === el) index = count; }"
        + "  }"
        + "  var step = el.tagName.toLowerCase();"
        + "  parts.unshift(count > 1 ? step + '[' + index + ']' : step);"
        + "}"
        + "return '/' + parts.join('/');";

    private final WebDriver webDriver;
    private final WebElement element;

    public SeleniumNodeBinding(WebDriver webDriver, WebElement element) {
        this.webDriver = Objects.requireNonNull(webDriver, "webDriver must not be null");
        this.element   = Objects.requireNonNull(element, "element must not be null");
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    @Override
    public String attribute(String name) {
        return SeleniumErrors.call(() -> element.getAttribute(name));
    }

    @Override
    public String allText() {
        return SeleniumErrors.call(() -> {
            String text = element.getDomProperty("textContent");
            return text == null ? "" : text.trim();
        });
    }

    @Override
    public String visibleText() {
        return SeleniumErrors.call(element::getText);
    }

    @Override
    public String value() {
        return SeleniumErrors.call(() -> element.getDomProperty("value"));
    }

    @Override
    public String tagName() {
        return SeleniumErrors.call(() -> element.getTagName().toLowerCase(Locale.ROOT));
    }

    @Override
    public String path() {
        if (!(webDriver instanceof JavascriptExecutor js)) {
            throw DriverException.notSupported("path");
        }
        return SeleniumErrors.call(() -> String.valueOf(js.executeScript(XPATH_SCRIPT, element)));
    }

    @Override public boolean isVisible()  { return SeleniumErrors.call(element::isDisplayed); }
    @Override public boolean isChecked()  { return SeleniumErrors.call(element::isSelected); }
    @Override public boolean isSelected() { return SeleniumErrors.call(element::isSelected); }
    @Override public boolean isDisabled() { return SeleniumErrors.call(() -> !element.isEnabled()); }

    @Override
    public boolean isReadonly() {
        return SeleniumErrors.call(() -> "true".equals(element.getDomProperty("readOnly")));
    }

    @Override
    public boolean isMultiple() {
        return SeleniumErrors.call(() -> element.getDomAttribute("multiple") != null);
    }

    // ── Actions, minimal forms ────────────────────────────────────────────────

    @Override
    public void set(String value) {
        SeleniumErrors.run(() -> {
            if (isToggle()) {
                if (element.isSelected() != Boolean.parseBoolean(value)) element.click();
                return;
            }
            element.clear();
            if (value != null && !value.isEmpty()) element.sendKeys(value);
        });
    }

    @Override
    public void selectOption() {
        SeleniumErrors.run(() -> {
            if (!element.isSelected()) element.click();
        });
    }

    @Override
    public void unselectOption() {
        SeleniumErrors.run(() -> {
            List<WebElement> selects = element.findElements(By.xpath("./ancestor::select[1]"));
            if (selects.isEmpty()) {
                throw new DriverException(DriverErrorKind.NOT_SUPPORTED,
                    "Cannot unselect an option outside a select list");
            }
            if (selects.get(0).getDomAttribute("multiple") == null) {
                throw new DriverException(DriverErrorKind.NOT_SUPPORTED,
                    "Cannot unselect an option of a single-select list");
            }
            if (element.isSelected()) element.click();
        });
    }

    @Override
    public void click() {
        SeleniumErrors.run(element::click);
    }

    @Override
    public void rightClick() {
        SeleniumErrors.run(() -> new Actions(webDriver).contextClick(element).perform());
    }

    @Override
    public void doubleClick() {
        SeleniumErrors.run(() -> new Actions(webDriver).doubleClick(element).perform());
    }

    @Override
    public void hover() {
        SeleniumErrors.run(() -> new Actions(webDriver).moveToElement(element).perform());
    }

    @Override
    public void sendKeys(CharSequence... keys) {
        SeleniumErrors.run(() -> element.sendKeys(keys));
    }

    @Override
    public void dragTo(NodeBinding target) {
        if (!(target instanceof SeleniumNodeBinding other)) {
            throw new IllegalArgumentException("Cannot drag onto a binding from another driver: " + target);
        }
        SeleniumErrors.run(() -> new Actions(webDriver).dragAndDrop(element, other.element).perform());
    }

    // ── Actions, extended forms ───────────────────────────────────────────────

    @Override
    public void set(String value, Map<String, Object> options) {
        Object clear = options.get("clear");
        if (clear == null) {
            set(value);
            return;
        }
        SeleniumErrors.run(() -> {
            switch (String.valueOf(clear)) {
                case "backspace" -> {
                    String current = element.getDomProperty("value");
                    int length = current == null ? 0 : current.length();
                    if (length > 0) element.sendKeys(Keys.BACK_SPACE.toString().repeat(length));
                }
                case "none" -> { }
                default -> throw new IllegalArgumentException("Unknown clear option: " + clear);
            }
            if (value != null && !value.isEmpty()) element.sendKeys(value);
        });
    }

    @Override
    public void click(ClickOptions options) {
        perform(options, Actions::click);
    }

    @Override
    public void rightClick(ClickOptions options) {
        perform(options, Actions::contextClick);
    }

    @Override
    public void doubleClick(ClickOptions options) {
        perform(options, Actions::doubleClick);
    }

    private void perform(ClickOptions options, Consumer<Actions> press) {
        SeleniumErrors.run(() -> {
            Actions actions = new Actions(webDriver);
            for (Modifier modifier : options.getModifiers()) {
                actions.keyDown(keyFor(modifier));
            }
            if (options.hasOffset()) {
                Dimension size = element.getSize();
                actions.moveToElement(element,
                    options.getX() - size.getWidth() / 2,
                    options.getY() - size.getHeight() / 2);
            } else {
                actions.moveToElement(element);
            }
            press.accept(actions);
            for (Modifier modifier : options.getModifiers()) {
                actions.keyUp(keyFor(modifier));
            }
            actions.perform();
        });
    }

    // ── Scoped lookup ─────────────────────────────────────────────────────────

    @Override
    public List<NodeBinding> findAll(Locator locator) {
        List<WebElement> found = SeleniumErrors.call(() -> element.findElements(SeleniumErrors.toBy(locator)));
        return SeleniumDriver.bindAll(webDriver, found, locator);
    }

    public WebElement getElement() {
        return element;
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private boolean isToggle() {
        if (!"input".equalsIgnoreCase(element.getTagName())) return false;
        String type = element.getDomAttribute("type");
        return "checkbox".equalsIgnoreCase(type) || "radio".equalsIgnoreCase(type);
    }

    static Keys keyFor(Modifier modifier) {
        return switch (modifier) {
            case ALT     -> Keys.ALT;
            case CONTROL -> Keys.CONTROL;
            case META    -> Keys.META;
            case SHIFT   -> Keys.SHIFT;
        };
    }

    // ── Identity ──────────────────────────────────────────────────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeleniumNodeBinding other)) return false;
        return element.equals(other.element);
    }

    @Override
    public int hashCode() {
        return element.hashCode();
    }

    @Override
    public String toString() {
        return "SeleniumNodeBinding{" + element + "}";
    }
}
