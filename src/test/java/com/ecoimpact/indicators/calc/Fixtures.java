package com.ecoimpact.indicators.calc;

import com.ecoimpact.indicators.reference.ReferenceEntry;
import com.ecoimpact.indicators.reference.ReferenceTable;

import java.util.List;

final class Fixtures {

    private Fixtures() {
    }

    static ReferenceEntry entry(int code, String className, double factor, double agc, double bgc,
                                double soc, double deoc, double naturalness) {
        return new ReferenceEntry(code, className, className + " Land", factor, className,
                agc, bgc, soc, deoc, naturalness, className + " description");
    }

    static ReferenceTable reference() {
        return ReferenceTable.of(List.of(
                entry(11, "Forest", 1.29, 60.0, 15.0, 100.0, 5.0, 4.5),
                entry(12, "Wetland", 1.29, 20.0, 5.0, 200.0, 2.0, 4.8),
                entry(13, "Cropland", 2.51, 2.0, 1.0, 50.0, 0.0, 1.5)));
    }

    static AreaRow area(int code, double hectares) {
        return new AreaRow(code, hectares);
    }
}
