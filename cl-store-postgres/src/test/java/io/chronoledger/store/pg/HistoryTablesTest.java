package io.chronoledger.store.pg;

import io.chronoledger.core.PolicyRegistry;
import io.chronoledger.core.TemporalPolicy;
import io.chronoledger.core.UnknownEntityTypeException;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HistoryTablesTest {

    private final PolicyRegistry policies = PolicyRegistry.of(
            TemporalPolicy.builder("Widget").track("description").composite("position", "lat", "lng").build(),
            TemporalPolicy.builder("contract").track("terms").build());

    @Test
    void namesFollowTheEntityTable() {
        var tables = HistoryTables.build(policies, Map.of("Widget", "widgets", "contract", "contracts")::get);

        assertThat(tables.clockTable("Widget")).isEqualTo("widgets_clock");
        assertThat(tables.historyTable("Widget", "description")).isEqualTo("widgets_history_description");
        assertThat(tables.historyTable("Widget", "position")).isEqualTo("widgets_history_position");
        assertThat(tables.historyTable("contract", "terms")).isEqualTo("contracts_history_terms");
    }

    @Test
    void defaultTableIsTheLowercasedType() {
        var tables = HistoryTables.build(policies);

        assertThat(tables.layout("Widget").entityTable()).isEqualTo("widget");
        assertThat(tables.layouts()).hasSize(2);
    }

    @Test
    void longNamesAreShortenedButStayDistinct() {
        var prefix = "a".repeat(60);
        var first = HistoryTables.truncate(prefix + "_history_first");
        var second = HistoryTables.truncate(prefix + "_history_second");

        assertThat(first).hasSize(60).startsWith("a".repeat(55) + "_");
        assertThat(second).hasSize(60);
        assertThat(first).isNotEqualTo(second);
        assertThat(HistoryTables.truncate(prefix + "_history_first")).isEqualTo(first);
        assertThat(HistoryTables.truncate("short_name")).isEqualTo("short_name");
    }

    @Test
    void unknownTypeOrAttributeIsRejected() {
        var tables = HistoryTables.build(policies);

        assertThatThrownBy(() -> tables.clockTable("gadget")).isInstanceOf(UnknownEntityTypeException.class);
        assertThatThrownBy(() -> tables.historyTable("Widget", "lat")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tableNamesMustBePlainIdentifiers() {
        assertThatThrownBy(() -> HistoryTables.build(policies, type -> "widgets; DROP TABLE x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void attributesDifferingOnlyInCaseAreRejected() {
        var clashing = PolicyRegistry.of(TemporalPolicy.builder("item").track("Price", "price").build());

        assertThatThrownBy(() -> HistoryTables.build(clashing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("item_history_price");
    }

    @Test
    void typesSharingATableAreRejected() {
        assertThatThrownBy(() -> HistoryTables.build(policies, type -> "shared"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shared");
    }

    @Test
    void lowerCasingIgnoresTheDefaultLocale() {
        var previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr"));
        try {
            var tables = HistoryTables.build(PolicyRegistry.of(TemporalPolicy.builder("ITEM").track("TITLE").build()));

            assertThat(tables.layout("ITEM").entityTable()).isEqualTo("item");
            assertThat(tables.historyTable("ITEM", "TITLE")).isEqualTo("item_history_title");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
