package com.glassbox.calc.spec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.glassbox.calc.recipe.ValidationRules;

import lombok.Data;

/**
 * A model as people write it: names instead of ids, {@code "Apr 2027"} dates,
 * {@code "18 months"} durations, key periods anchored to each other and
 * formulas that may cite {@code {Symbol Name}}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ModelSpec {
    private ProjectSpec project;
    private TimelineSpec timeline;
    private List<KeyPeriodSpec> keyPeriods = new ArrayList<>();
    private List<IndexSpec> indices = new ArrayList<>();
    private List<ConstantSpec> constants = new ArrayList<>();
    private List<InputGroupSpec> inputGroups = new ArrayList<>();
    private List<InputSpec> inputs = new ArrayList<>();
    private List<CalculationGroupSpec> calculationGroups = new ArrayList<>();
    private List<CalculationSpec> calculations = new ArrayList<>();
    private List<ModuleSpec> modules = new ArrayList<>();
    private ValidationRules validation;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ProjectSpec {
        private String name, type;
        private String currency = "AUD";
        /** Month the financial year ends in; June when absent. */
        private Integer financialYearEnd;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TimelineSpec {
        private String start, end;
    }

    /**
     * {@code start} is {@code timeline.start}, {@code after F2}, {@code with F2}
     * or a literal {@code "Mon YYYY"} date.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class KeyPeriodSpec {
        private Integer id;
        private String name, flag, start, duration;
        /** Extra months added to an {@code after}/{@code with} anchor. */
        private Integer offset;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class IndexSpec {
        private Integer id;
        private String name;
        private double rate;
        private String period;
        private Integer startYear, startMonth;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConstantSpec {
        private Integer id;
        private String name, unit;
        private Double value;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class InputGroupSpec {
        private Integer id;
        private String name;
        private String mode = "values";
        private String frequency = "M";
        /** Flag of the key period whose span the inputs cover. */
        private String linkedPeriod;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class InputSpec {
        private Integer id;
        private String name, group, unit, frequency;
        private Double value;
        private Map<Integer, Double> values;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CalculationGroupSpec {
        private Integer id;
        private String name, tab;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CalculationSpec {
        private Integer id;
        private String name, group, formula, description;
        private String type = "flow";
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ModuleSpec {
        private Integer id;
        private String name, tab;
        @JsonAlias("templateId")
        private String template;
        private Map<String, String> inputs = new LinkedHashMap<>();
        private List<ExtraCalculationSpec> extraCalculations = new ArrayList<>();
        private boolean enabled = true;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ExtraCalculationSpec {
        private String key, name, formula, description;
        private String type = "flow";
    }
}
