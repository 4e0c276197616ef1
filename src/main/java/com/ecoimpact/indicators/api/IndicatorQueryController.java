package com.ecoimpact.indicators.api;

import com.ecoimpact.indicators.config.IndicatorProps;
import com.ecoimpact.indicators.domain.Indicator;
import com.ecoimpact.indicators.ingest.CarbonPriceScheduleReader;
import com.ecoimpact.indicators.projection.CostProjector;
import com.ecoimpact.indicators.projection.DiscountedCost;
import com.ecoimpact.indicators.report.ClassSummary;
import com.ecoimpact.indicators.report.ReportAggregator;
import com.ecoimpact.indicators.store.ResultStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.List;

/**
 * 저장된 결과 조회 (읽기 전용)
 */
@RestController
@RequestMapping("/api/indicators")
@RequiredArgsConstructor
public class IndicatorQueryController {

    private final ResultStore resultStore;
    private final ReportAggregator reportAggregator;
    private final CostProjector costProjector;
    private final CarbonPriceScheduleReader priceReader;
    private final IndicatorProps props;

    @GetMapping("/{indicator}/rows")
    public List<?> rows(@PathVariable String indicator) {
        return resultStore.findAll(Indicator.fromKey(indicator));
    }

    @GetMapping("/{indicator}/summary")
    public List<ClassSummary> summary(@PathVariable String indicator) {
        return reportAggregator.summarize(Indicator.fromKey(indicator));
    }

    @GetMapping(value = "/{indicator}/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public String report(@PathVariable String indicator,
                         @RequestParam(required = false) String studyArea) {
        String area = (studyArea == null || studyArea.isBlank()) ? props.getStudyArea() : studyArea;
        return reportAggregator.render(Indicator.fromKey(indicator), area);
    }

    /** 저장된 탄소 결과 기준 할인 사회적 비용 시계열 */
    @GetMapping("/carbon_sequestration/cost-projection")
    public List<DiscountedCost> costProjection(@RequestParam(required = false) Integer startYear,
                                               @RequestParam(required = false) Integer endYear,
                                               @RequestParam(required = false) Double discountRate) {
        IndicatorProps.Projection p = props.getProjection();
        return costProjector.project(
                resultStore.totalSscMillions(),
                priceReader.read(Path.of(props.getInput().getSccScheduleCsv())),
                startYear != null ? startYear : p.getStartYear(),
                endYear != null ? endYear : p.getEndYear(),
                discountRate != null ? discountRate : p.getDiscountRate(),
                p.getReferencePrice());
    }
}
