package com.ecoimpact.indicators.api;

import com.ecoimpact.indicators.config.IndicatorProps;
import com.ecoimpact.indicators.domain.Indicator;
import com.ecoimpact.indicators.ingest.CarbonPriceScheduleReader;
import com.ecoimpact.indicators.projection.CostProjector;
import com.ecoimpact.indicators.report.ClassSummary;
import com.ecoimpact.indicators.report.ReportAggregator;
import com.ecoimpact.indicators.store.ResultStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.util.List;
import java.util.TreeMap;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = IndicatorQueryController.class)
class IndicatorQueryControllerWebTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    ResultStore resultStore;

    @MockBean
    ReportAggregator reportAggregator;

    @SpyBean
    CostProjector costProjector;

    @MockBean
    CarbonPriceScheduleReader priceReader;

    @MockBean
    IndicatorProps props;

    @Test
    void report_isPlainTextForConfiguredStudyArea() throws Exception {
        when(props.getStudyArea()).thenReturn("test_zone");
        when(reportAggregator.render(Indicator.WATER_FILTRATION, "test_zone")).thenReturn("WATER FILTRATION ANALYSIS REPORT\n");

        mvc.perform(get("/api/indicators/water/report"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/plain"))
                .andExpect(content().string("WATER FILTRATION ANALYSIS REPORT\n"));
    }

    @Test
    void summary_returnsClassLevelRows() throws Exception {
        when(reportAggregator.summarize(Indicator.BIOCAPACITY))
                .thenReturn(List.of(new ClassSummary("Forest", 100.0, 129.0, 100.0, 100.0)));

        mvc.perform(get("/api/indicators/biocapacity/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].className").value("Forest"))
                .andExpect(jsonPath("$[0].metric").value(129.0));
    }

    @Test
    void costProjection_usesStoredAggregate() throws Exception {
        TreeMap<Integer, Double> schedule = new TreeMap<>();
        schedule.put(2020, 252.0);
        when(props.getProjection()).thenReturn(new IndicatorProps.Projection());
        when(props.getInput()).thenReturn(new IndicatorProps.Input());
        when(priceReader.read(any(Path.class))).thenReturn(schedule);
        when(resultStore.totalSscMillions()).thenReturn(2.52);

        mvc.perform(get("/api/indicators/carbon_sequestration/cost-projection")
                        .param("startYear", "2020").param("endYear", "2021").param("discountRate", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].year").value(2020))
                .andExpect(jsonPath("$[1].value", closeTo(2.52, 1e-9)));
    }
}
