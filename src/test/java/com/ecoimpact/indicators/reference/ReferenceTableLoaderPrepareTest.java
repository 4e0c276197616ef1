package com.ecoimpact.indicators.reference;

import com.ecoimpact.indicators.exception.SchemaException;
import com.ecoimpact.indicators.ingest.TabularData;
import com.ecoimpact.indicators.ingest.TabularFileReader;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceTableLoaderPrepareTest {

    private static final List<String> HEADERS = List.of("code", "class", "biocapacity_category",
            "biocapacity_factor", "land_use_category", "agc", "bgc", "soc", "deoc", "naturalness", "description");

    private final ReferenceTableLoader loader =
            new ReferenceTableLoader(new TabularFileReader(), null, null, null, null);

    @Test
    void rowsWithAnyMissingValueAreDropped() {
        TabularData data = table(HEADERS,
                row("11", "Forest", "Forest Land", "1.29", "Forest", "60", "15", "100", "5", "4.5", "forest"),
                row("14", "Built-up", "Built-up Land", "2.51", "Settlement", "0", "0", "0", "0", "0.5", null));

        ReferenceTableLoader.Prepared prepared = loader.prepare(data, Map.of());

        assertThat(prepared.entries()).extracting(ReferenceEntry::code).containsExactly(11);
        assertThat(prepared.dropped()).isEqualTo(1);
        ReferenceEntry forest = prepared.entries().get(0);
        assertThat(forest.biocapacityFactor()).isEqualTo(1.29);
        assertThat(forest.agc() + forest.bgc() + forest.soc() + forest.deoc()).isEqualTo(180.0);
    }

    @Test
    void overridesApplyBeforeTheNullFilter() {
        TabularData data = table(HEADERS,
                row("14", "Built-up", "Built-up Land", "2.51", "Settlement", "0", "0", "0", "0", "0.5", null),
                row("11", "Forest", "Forest Land", "1.29", "Forest", "60", "15", "100", "5", "4.5", "forest"));

        Map<Integer, Map<String, String>> overrides = Map.of(
                14, Map.of("description", "filled in"),
                11, Map.of("biocapacity_factor", "0.60"));

        ReferenceTableLoader.Prepared prepared = loader.prepare(data, overrides);

        assertThat(prepared.entries()).extracting(ReferenceEntry::code).containsExactly(14, 11);
        assertThat(prepared.dropped()).isZero();
        assertThat(prepared.overridesApplied()).isEqualTo(2);
        assertThat(prepared.entries().get(1).biocapacityFactor()).isEqualTo(0.60);
    }

    @Test
    void legacyHeaderNamesAreAccepted() {
        List<String> legacy = List.of("solris_code", "solris_class", "biocapacity_category",
                "biocapacity_conversion_factor", "lulc_category", "agc_tc_ha", "bgc_tc_ha", "soc_tc_ha",
                "deoc_tc_ha", "naturalness", "description");
        TabularData data = table(legacy,
                row("11.0", "Forest", "Forest Land", "1.29", "Forest", "60", "15", "100", "5", "4.5", "forest"));

        assertThat(loader.prepare(data, Map.of()).entries())
                .singleElement()
                .satisfies(e -> assertThat(e.code()).isEqualTo(11));
    }

    @Test
    void missingColumnFailsBeforeAnything() {
        List<String> headers = new ArrayList<>(HEADERS);
        headers.remove("naturalness");
        TabularData data = table(headers);

        assertThatThrownBy(() -> loader.prepare(data, Map.of()))
                .isInstanceOf(SchemaException.class)
                .satisfies(e -> assertThat(((SchemaException) e).getMissingColumns()).containsExactly("naturalness"));
    }

    @Test
    void unknownOverrideFieldIsRejected() {
        TabularData data = table(HEADERS);

        assertThatThrownBy(() -> loader.prepare(data, Map.of(11, Map.of("colour", "green"))))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("colour");
        assertThatThrownBy(() -> loader.prepare(data, Map.of(11, Map.of("code", "12"))))
                .isInstanceOf(SchemaException.class);
    }

    @Test
    void duplicateCodesAreRejected() {
        TabularData data = table(HEADERS,
                row("11", "Forest", "Forest Land", "1.29", "Forest", "60", "15", "100", "5", "4.5", "a"),
                row("11", "Forest 2", "Forest Land", "1.29", "Forest", "60", "15", "100", "5", "4.5", "b"));

        assertThatThrownBy(() -> loader.prepare(data, Map.of()))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("duplicate");
    }

    private static String[] row(String... values) {
        return values;
    }

    private static TabularData table(List<String> headers, String[]... rows) {
        List<Map<String, String>> maps = new ArrayList<>();
        for (String[] values : rows) {
            Map<String, String> map = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                map.put(headers.get(i), values[i]);
            }
            maps.add(map);
        }
        return new TabularData("test.csv", headers, maps);
    }
}
