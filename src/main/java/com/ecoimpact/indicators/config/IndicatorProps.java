package com.ecoimpact.indicators.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * application.yml 의 ecoservices.* 바인딩
 *
 * 예)
 * ecoservices:
 *   study-area: carolinian_zone
 *   input:
 *     reference-csv: data/solris_lookup.csv
 *     area-workbook: data/carolinian_polygon_summary.xlsx
 *   overrides:
 *     33:
 *       biocapacity_factor: 0.60
 *   run:
 *     mode: carbon_sequestration
 */
@Configuration
@ConfigurationProperties(prefix = "ecoservices")
public class IndicatorProps {

    private String studyArea = "carolinian_zone";
    private String outputDir = "output";

    /** 코드별 기준표 필드 덮어쓰기 (null 필터 이전에 적용) */
    private Map<Integer, Map<String, String>> overrides = new LinkedHashMap<>();

    private Input input = new Input();
    private Projection projection = new Projection();
    private Run run = new Run();

    // --- nested types ---
    public static class Input {
        private String referenceCsv = "solris_lookup.csv";
        private String areaWorkbook = "carolinian_polygon_summary.xlsx";
        private String wetlandValuesCsv = "water_filtration_lookup.csv";
        private String sccScheduleCsv = "annual-scc.csv";

        public String getReferenceCsv() { return referenceCsv; }
        public void setReferenceCsv(String referenceCsv) { this.referenceCsv = referenceCsv; }

        public String getAreaWorkbook() { return areaWorkbook; }
        public void setAreaWorkbook(String areaWorkbook) { this.areaWorkbook = areaWorkbook; }

        public String getWetlandValuesCsv() { return wetlandValuesCsv; }
        public void setWetlandValuesCsv(String wetlandValuesCsv) { this.wetlandValuesCsv = wetlandValuesCsv; }

        public String getSccScheduleCsv() { return sccScheduleCsv; }
        public void setSccScheduleCsv(String sccScheduleCsv) { this.sccScheduleCsv = sccScheduleCsv; }
    }

    public static class Projection {
        private int startYear = 2020;
        private int endYear = 2080;
        private double discountRate = 0.02;
        /** 기준연도(2021) 탄소 가격 */
        private double referencePrice = 252.0;

        public int getStartYear() { return startYear; }
        public void setStartYear(int startYear) { this.startYear = startYear; }

        public int getEndYear() { return endYear; }
        public void setEndYear(int endYear) { this.endYear = endYear; }

        public double getDiscountRate() { return discountRate; }
        public void setDiscountRate(double discountRate) { this.discountRate = discountRate; }

        public double getReferencePrice() { return referencePrice; }
        public void setReferencePrice(double referencePrice) { this.referencePrice = referencePrice; }
    }

    public static class Run {
        /** reindex | biocapacity | carbon_sequestration | water_filtration | aesthetic_quality | none */
        private String mode = "none";
        private boolean exitOnCompletion = false;

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public boolean isExitOnCompletion() { return exitOnCompletion; }
        public void setExitOnCompletion(boolean exitOnCompletion) { this.exitOnCompletion = exitOnCompletion; }
    }

    // --- getters/setters ---
    public String getStudyArea() { return studyArea; }
    public void setStudyArea(String studyArea) { this.studyArea = studyArea; }

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public Map<Integer, Map<String, String>> getOverrides() { return overrides; }
    public void setOverrides(Map<Integer, Map<String, String>> overrides) { this.overrides = overrides; }

    public Input getInput() { return input; }
    public void setInput(Input input) { this.input = input; }

    public Projection getProjection() { return projection; }
    public void setProjection(Projection projection) { this.projection = projection; }

    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }
}
