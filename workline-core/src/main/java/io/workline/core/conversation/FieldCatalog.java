package io.workline.core.conversation;

import io.workline.core.session.FieldValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Names of the profile fields and the weighted coverage score over them. A field counts as
 * covered once any of its values reaches the minimum confidence.
 */
public final class FieldCatalog {
    public static final String FULL_NAME = "full_name";
    public static final String EMPLOYER_NAME = "employer_name";
    public static final String JOB_TITLE = "job_title";
    public static final String START_DATE = "start_date";
    public static final String END_DATE = "end_date";
    public static final String INDUSTRY = "industry";
    public static final String SCHOOL_NAME = "school_name";
    public static final String DEGREE = "degree";
    public static final String SKILLS = "skills";

    public static final List<String> REQUIRED = List.of(EMPLOYER_NAME, JOB_TITLE, START_DATE, END_DATE);
    public static final List<String> OPTIONAL = List.of(SCHOOL_NAME, DEGREE, SKILLS);

    private final double requiredWeight;
    private final double optionalWeight;
    private final double minConfidence;

    public FieldCatalog(double requiredWeight, double optionalWeight, double minConfidence) {
        this.requiredWeight = requiredWeight;
        this.optionalWeight = optionalWeight;
        this.minConfidence = minConfidence;
    }

    public static FieldCatalog from(ConversationSettings settings) {
        return new FieldCatalog(settings.requiredWeight(), settings.optionalWeight(), settings.minFieldConfidence());
    }

    public boolean covered(Map<String, List<FieldValue>> fields, String name) {
        List<FieldValue> values = fields.get(name);
        if (values == null) {
            return false;
        }
        return values.stream().anyMatch(v -> !v.value().isBlank() && v.confidence() >= minConfidence);
    }

    public double completeness(Map<String, List<FieldValue>> fields) {
        double score = requiredWeight * fraction(fields, REQUIRED) + optionalWeight * fraction(fields, OPTIONAL);
        return Math.round(Math.min(score, 1.0) * 1000) / 1000.0;
    }

    public List<String> missing(Map<String, List<FieldValue>> fields) {
        List<String> missing = new ArrayList<>();
        for (String name : REQUIRED) {
            if (!covered(fields, name)) {
                missing.add(name);
            }
        }
        for (String name : OPTIONAL) {
            if (!covered(fields, name)) {
                missing.add(name);
            }
        }
        return missing;
    }

    private double fraction(Map<String, List<FieldValue>> fields, List<String> names) {
        long covered = names.stream().filter(name -> covered(fields, name)).count();
        return (double) covered / names.size();
    }
}
