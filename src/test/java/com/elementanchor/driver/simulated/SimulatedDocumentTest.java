package com.elementanchor.driver.simulated;

import com.elementanchor.driver.DriverErrorKind;
import com.elementanchor.driver.DriverException;
import com.elementanchor.driver.NodeBinding;
import com.elementanchor.model.ClickOptions;
import com.elementanchor.model.Locator;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * The in-memory document and the driver built on it. No handles, no synchronization.
 */
public class SimulatedDocumentTest {

    private SimulatedDocument document;
    private SimulatedDriver driver;

    @BeforeMethod
    public void setUp() {
        document = SimulatedDocument.fromResource("/pages/form.json");
        driver = SimulatedDriver.builder().document(document).build();
    }

    private static DriverErrorKind kindOf(Throwable e) {
        return ((DriverException) e).getKind();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Loading
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void fixtureLoadsWithUnknownPropertiesIgnored() {
        assertThat(document.getRoot().getTag()).isEqualTo("html");
        assertThat(document.first(Locator.id("email")).getValue()).isEqualTo("ada@example.com");
    }

    @Test
    public void valueFallsBackToValueAttribute() {
        assertThat(document.first(Locator.id("country-fr")).getValue()).isEqualTo("fr");
    }

    @Test
    public void malformedJsonIsReported() {
        ByteArrayInputStream broken = new ByteArrayInputStream("{\"tag\": ".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> SimulatedDocument.load(broken))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("Could not parse simulated document");
    }

    @Test
    public void missingResourceIsReported() {
        assertThatThrownBy(() -> SimulatedDocument.fromResource("/pages/nope.json"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("/pages/nope.json");
    }

    @Test
    public void documentsCanBeBuiltInCode() {
        SimulatedDocument built = new SimulatedDocument(new SimulatedNodeSpec("html")
            .child(new SimulatedNodeSpec("p").attr("id", "greeting").withText("Hello")));

        assertThat(built.first(Locator.id("greeting")).allText()).isEqualTo("Hello");
        assertThat(built.first(Locator.id("greeting")).path()).isEqualTo("/html/p");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Lookup
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void lookupByEachSupportedKind() {
        assertThat(document.findAll(Locator.of(Locator.NAME, "email"))).hasSize(1);
        assertThat(document.findAll(Locator.of(Locator.TAG, "option"))).hasSize(5);
        assertThat(document.findAll(Locator.of(Locator.CLASS, "primary"))).hasSize(1);
        assertThat(document.findAll(Locator.of(Locator.TEXT, "Two"))).hasSize(1);
        assertThat(document.findAll(Locator.of(Locator.TAG, "html"))).hasSize(1);
    }

    @Test
    public void unsupportedOrBlankSelectorIsInvalid() {
        assertThatThrownBy(() -> driver.findAll(Locator.css("#name")))
            .isInstanceOf(DriverException.class)
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(DriverErrorKind.INVALID_SELECTOR));
        assertThatThrownBy(() -> driver.findAll(Locator.id(" ")))
            .isInstanceOf(DriverException.class)
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(DriverErrorKind.INVALID_SELECTOR));
    }

    @Test
    public void hiddenAncestorHidesSubtree() {
        SimulatedNode secret = document.first(Locator.id("secret"));

        assertThat(secret.isVisible()).isFalse();
        assertThat(secret.visibleText()).isEmpty();
        assertThat(secret.allText()).isEqualTo("hidden detail");
    }

    @Test
    public void pathIndexesOnlySameTagSiblings() {
        assertThat(document.first(Locator.id("email")).path()).isEqualTo("/html/body/form/input[2]");
        assertThat(document.first(Locator.id("country")).path()).isEqualTo("/html/body/form/select[1]");
        assertThat(document.first(Locator.id("notice")).path()).isEqualTo("/html/body/div");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Mutation and staleness
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void rerenderDetachesOriginalButKeepsState() {
        SimulatedNode original = document.first(Locator.id("terms"));
        original.setChecked(true);

        SimulatedNode replacement = document.rerender(Locator.id("terms"));

        assertThat(original.isAttached()).isFalse();
        assertThat(replacement.isAttached()).isTrue();
        assertThat(replacement.isChecked()).isTrue();
        assertThat(document.first(Locator.id("terms"))).isSameAs(replacement);
    }

    @Test
    public void bindingToDetachedNodeReportsStaleReference() {
        NodeBinding binding = driver.findAll(Locator.id("name")).get(0);
        document.remove(Locator.id("name"));

        assertThatThrownBy(binding::tagName)
            .isInstanceOf(DriverException.class)
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(DriverErrorKind.STALE_REFERENCE));
        assertThat(driver.calls()).last().extracting(SimulatedDriver.Call::path).isNull();
    }

    @Test
    public void rootCannotBeRemoved() {
        assertThatThrownBy(() -> document.remove(Locator.of(Locator.TAG, "html")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void appendedNodesAreFound() {
        document.append(Locator.id("items"),
            new SimulatedNodeSpec("li").attr("class", "item").withText("Three"));

        assertThat(document.findAll(Locator.of(Locator.CLASS, "item"))).hasSize(3);
    }

    @Test
    public void disabledNodeIgnoresClicks() {
        document.setDisabled(Locator.id("terms"), true);
        NodeBinding terms = driver.findAll(Locator.id("terms")).get(0);

        terms.click();

        assertThat(terms.isChecked()).isFalse();
        assertThat(terms.isDisabled()).isTrue();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Driver controls
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void bindingsToSameNodeAreEqual() {
        NodeBinding first  = driver.findAll(Locator.id("name")).get(0);
        NodeBinding second = driver.findAll(Locator.id("name")).get(0);

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(driver.findAll(Locator.id("email")).get(0));
    }

    @Test
    public void injectedFaultsAreConsumedInOrder() {
        NodeBinding submit = driver.findAll(Locator.id("submit")).get(0);
        driver.failNext("hover", 1, DriverErrorKind.NOT_INTERACTABLE)
              .failNext("hover", 1, DriverErrorKind.CLICK_INTERCEPTED);

        assertThatThrownBy(submit::hover)
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(DriverErrorKind.NOT_INTERACTABLE));
        assertThatThrownBy(submit::hover)
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(DriverErrorKind.CLICK_INTERCEPTED));
        submit.hover();

        assertThat(driver.callCount("hover")).isEqualTo(3);
    }

    @Test
    public void minimalBindingRejectsExtendedForms() {
        NodeBinding name = driver.findAll(Locator.id("name")).get(0);

        assertThatThrownBy(() -> name.click(ClickOptions.offset(1, 1)))
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(DriverErrorKind.NOT_SUPPORTED));
        assertThat(name).isExactlyInstanceOf(SimulatedNodeBinding.class);
    }

    @Test
    public void extendedDriverHandsOutExtendedBindings() {
        SimulatedDriver extended = SimulatedDriver.builder().document(document).extendedForms(true).build();

        List<NodeBinding> found = extended.findAll(Locator.id("name"));

        assertThat(found.get(0)).isInstanceOf(ExtendedSimulatedNodeBinding.class);
    }

    @Test
    public void driverDefaults() {
        assertThat(driver.name()).isEqualTo("simulated");
        assertThat(driver.needsWaiting()).isFalse();
        assertThat(driver.invalidElementErrors()).containsExactly(DriverErrorKind.STALE_REFERENCE);
    }

    @Test
    public void emptyInvalidElementErrorsAreRejected() {
        assertThatThrownBy(() -> SimulatedDriver.builder()
                .document(document)
                .invalidElementErrors(EnumSet.noneOf(DriverErrorKind.class))
                .build())
            .isInstanceOf(IllegalStateException.class);
    }
}
