package com.ecoimpact.indicators.reference;

import com.ecoimpact.indicators.calc.*;
import com.ecoimpact.indicators.domain.Indicator;
import com.ecoimpact.indicators.exception.SchemaException;
import com.ecoimpact.indicators.repo.LandCoverClassRepository;
import com.ecoimpact.indicators.store.ResultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class ReferenceReloadIntegrationTest {

    @Autowired
    ReferenceTableLoader loader;

    @Autowired
    ResultStore resultStore;

    @Autowired
    LandCoverClassRepository landCoverRepo;

    @Autowired
    BiocapacityCalculator biocapacity;

    @Autowired
    CarbonSequestrationCalculator carbon;

    @Autowired
    WaterFiltrationCalculator water;

    @Autowired
    AestheticQualityCalculator aesthetic;

    private Path referenceCsv;

    @BeforeEach
    void setUp() throws IOException {
        referenceCsv = new ClassPathResource("fixtures/reference.csv").getFile().toPath();
        resultStore.clearAllDependents();
    }

    @Test
    void loadWithoutDependentsDoesNotCascade() {
        ReferenceLoadResult result = loader.load(referenceCsv, Map.of());

        assertThat(result.cascaded()).isFalse();
        assertThat(result.rowsRead()).isEqualTo(4);
        assertThat(result.rowsLoaded()).isEqualTo(3);
        assertThat(result.rowsDropped()).isEqualTo(1);
        assertThat(landCoverRepo.findAllCodes()).containsExactlyInAnyOrder(11, 12, 13);
    }

    @Test
    void reloadWithDependentRowsCascadesAndEmptiesAllResultTables() {
        loader.load(referenceCsv, Map.of());
        ReferenceTable reference = loader.current();
        List<AreaRow> areas = List.of(new AreaRow(11, 100.0), new AreaRow(12, 50.0), new AreaRow(13, 1000.0));

        resultStore.persist(Indicator.BIOCAPACITY, biocapacity.calculate(areas, reference));
        resultStore.persist(Indicator.CARBON_SEQUESTRATION, carbon.calculate(areas, reference));
        resultStore.persist(Indicator.WATER_FILTRATION, water.calculate(areas, reference, Map.of("Wetland", 12000.0)));
        resultStore.persist(Indicator.AESTHETIC_QUALITY, aesthetic.calculate(areas, reference));
        assertThat(resultStore.countAll().values()).allSatisfy(count -> assertThat(count).isEqualTo(3L));

        ReferenceLoadResult result = loader.load(referenceCsv, Map.of(14, Map.of("description", "built-up")));

        assertThat(result.cascaded()).isTrue();
        assertThat(result.rowsLoaded()).isEqualTo(4);
        assertThat(resultStore.countAll().values()).allSatisfy(count -> assertThat(count).isZero());
        assertThat(loader.current().find(14)).hasValueSatisfying(e ->
                assertThat(e.description()).isEqualTo("built-up"));
    }

    @Test
    void overriddenValuesArePersisted() {
        loader.load(referenceCsv, Map.of(13, Map.of("biocapacity_factor", "0.60")));

        assertThat(loader.current().find(13)).hasValueSatisfying(e ->
                assertThat(e.biocapacityFactor()).isEqualTo(0.60));
    }

    @Test
    void schemaErrorLeavesExistingTableUntouched() throws IOException {
        loader.load(referenceCsv, Map.of());
        Path broken = new ClassPathResource("fixtures/areas.csv").getFile().toPath();

        assertThatThrownBy(() -> loader.load(broken, Map.of()))
                .isInstanceOf(SchemaException.class);
        assertThat(landCoverRepo.count()).isEqualTo(3);
    }
}
