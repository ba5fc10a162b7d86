package com.glassbox.calc.recipe;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * Addressed form of a model: every input, flag, index and calculation already
 * carries its numeric identity. Produced by the spec compiler, or loaded
 * directly from JSON.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class Recipe {
    private ProjectInfo project;
    private TimelineDef timeline;
    private List<KeyPeriodDef> keyPeriods = new ArrayList<>();
    private List<IndexDef> indices = new ArrayList<>();
    private List<InputGroupDef> inputGroups = new ArrayList<>();
    private List<InputDef> inputs = new ArrayList<>();
    private List<CalculationGroupDef> calculationGroups = new ArrayList<>();
    private List<CalculationDef> calculations = new ArrayList<>();
    private List<ModuleDef> modules = new ArrayList<>();
    /** {@code M{n}.{k}} to {@code R{id}} for module outputs. */
    @JsonAlias("mRefMap")
    private Map<String, String> moduleRefs = new LinkedHashMap<>();
    private ValidationRules validation;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ProjectInfo {
        private String name, type, currency;
        /** Calendar month in which the financial year ends. */
        private Integer financialYearEndMonth;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TimelineDef {
        private int startYear, startMonth, endYear, endMonth;
    }

    /** A named date range. Dates stay null when they could not be resolved. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class KeyPeriodDef {
        private int id;
        private String name, flag;
        private Integer startYear, startMonth, endYear, endMonth, periods;

        public boolean hasDates() {
            return startYear != null && startMonth != null && endYear != null && endMonth != null;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class IndexDef {
        private int id;
        private String name;
        /** Annual rate in percent. */
        private double rate;
        /** {@code annual} (step once a year) or {@code monthly} (compound monthly). */
        private String period;
        private Integer startYear, startMonth;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class InputGroupDef {
        private int id;
        private String name, mode, frequency;
        /** Reference assigned when the recipe was authored; the namespace may renumber it. */
        private String ref;
        private Integer linkedKeyPeriodId, startYear, startMonth, periods;
        private List<SubgroupDef> subgroups;
        /** Selected option per subgroup id ({@code root} for inputs without a subgroup). */
        private Map<String, Integer> selectedIndices;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SubgroupDef {
        private int id;
        private String name;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class InputDef {
        private int id, groupId;
        private String name, ref, unit, frequency;
        private Double value;
        /** Sparse values keyed by offset into the group's span. */
        private Map<Integer, Double> values;
        private Integer subgroupId;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class CalculationGroupDef {
        private int id;
        private String name, tab;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class CalculationDef {
        private int id;
        private Integer groupId, moduleId;
        private String name, formula, type, description, moduleOutputKey;
        @JsonAlias("isSolver")
        private boolean solver;
    }

    /** Expansion record of one module instance. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ModuleDef {
        private int id;
        private String name, templateId;
        private Map<String, String> inputs;
        private boolean enabled = true;
        private List<Integer> outputCalcIds;
    }
}
