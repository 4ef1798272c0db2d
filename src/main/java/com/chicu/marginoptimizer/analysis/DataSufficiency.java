package com.chicu.marginoptimizer.analysis;

import java.util.List;

public record DataSufficiency(boolean ok, List<String> reasons) {

    public DataSufficiency {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
