package io.workline.core.conversation;

import io.workline.core.timeline.GapReasonCategory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HeuristicUtteranceClassifier implements UtteranceClassifier {
    private static final Pattern YEAR_PATTERN = Pattern.compile("\\b(?:19|20)\\d{2}\\b");
    private static final Pattern EMPLOYER_PATTERN = Pattern.compile(
        "\\b(?:worked at|work at|working at|worked for|job at|employed by|company called)\\s+([A-Za-z0-9&'.-]+(?:\\s+[A-Za-z0-9&'.-]+){0,2})",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern NAME_PATTERN = Pattern.compile(
        "\\b(?:my name is|my name's|name is)\\s+([A-Za-z][A-Za-z'-]*(?:\\s+[A-Za-z][A-Za-z'-]*){0,2})",
        Pattern.CASE_INSENSITIVE
    );
    private static final Set<String> PHRASE_STOPWORDS = Set.of(
        "from", "in", "as", "until", "since", "for", "during", "between", "and", "but", "when", "back", "around"
    );
    private static final List<String> EVASIVE_PHRASES = List.of(
        "i don't know", "maybe", "i guess", "whatever", "i don't remember", "not sure", "don't care"
    );
    private static final List<String> HOSTILE_TERMS = List.of("no", "stop", "leave me alone", "annoying", "stupid");
    private static final List<String> SELF_CORRECTIONS = List.of("actually", "wait", "i mean");
    private static final List<String> TERMINATION_PHRASES = List.of(
        "stop calling", "leave me alone", "hang up", "goodbye", "bye", "don't call", "do not call",
        "not interested", "end the call", "take me off"
    );
    private static final List<String> TITLE_KEYWORDS = List.of(
        "manager", "supervisor", "worker", "operator", "technician", "assistant", "clerk", "driver",
        "mechanic", "welder", "assembler", "inspector", "foreman", "lead"
    );
    private static final List<String> INDUSTRY_KEYWORDS = List.of(
        "construction", "manufacturing", "retail", "food service", "healthcare", "cleaning", "security",
        "transportation", "warehouse", "assembly", "maintenance", "landscaping"
    );
    private static final List<String> SCHOOL_KEYWORDS = List.of("university", "college", "school", "institute", "academy");
    private static final List<String> DEGREE_KEYWORDS = List.of(
        "bachelor", "master", "associate", "certificate", "diploma", "ged", "degree"
    );
    private static final List<String> SKILL_KEYWORDS = List.of(
        "excel", "powerpoint", "autocad", "forklift", "welding", "machining", "assembly",
        "quality control", "safety", "leadership", "communication", "teamwork", "problem solving",
        "customer service", "cash handling", "cdl"
    );

    @Override
    public Classification classify(String utterance, List<String> previousUtterances) {
        String input = utterance == null ? "" : utterance.trim();
        String lowered = input.toLowerCase(Locale.ROOT);
        List<String> previous = previousUtterances == null ? List.of() : previousUtterances;

        double score = adversarialScore(input, lowered, previous);
        List<Integer> years = years(input);
        Map<String, List<String>> fields = new LinkedHashMap<>();

        put(fields, FieldCatalog.FULL_NAME, name(input));
        put(fields, FieldCatalog.EMPLOYER_NAME, employer(input));
        put(fields, FieldCatalog.JOB_TITLE, firstKeyword(lowered, TITLE_KEYWORDS));
        put(fields, FieldCatalog.INDUSTRY, firstKeyword(lowered, INDUSTRY_KEYWORDS));
        put(fields, FieldCatalog.SCHOOL_NAME, school(input, lowered));
        String degree = firstKeyword(lowered, DEGREE_KEYWORDS);
        put(fields, FieldCatalog.DEGREE, degree == null ? null : capitalize(degree));
        for (String skill : allKeywords(lowered, SKILL_KEYWORDS)) {
            put(fields, FieldCatalog.SKILLS, capitalize(skill));
        }

        boolean employment = fields.containsKey(FieldCatalog.EMPLOYER_NAME) || fields.containsKey(FieldCatalog.JOB_TITLE);
        boolean education = fields.containsKey(FieldCatalog.SCHOOL_NAME) || fields.containsKey(FieldCatalog.DEGREE);
        String gapReason = null;
        if (!years.isEmpty() && !employment && GapReasonCategory.categorize(lowered) != GapReasonCategory.OTHER) {
            gapReason = input.length() > 200 ? input.substring(0, 200) : input;
        }
        if (!years.isEmpty() && gapReason == null && !education) {
            put(fields, FieldCatalog.START_DATE, Integer.toString(years.get(0)));
            if (years.size() > 1) {
                put(fields, FieldCatalog.END_DATE, Integer.toString(years.get(years.size() - 1)));
            }
        }

        return new Classification(score, fields, years, gapReason, containsAny(lowered, TERMINATION_PHRASES));
    }

    private double adversarialScore(String input, String lowered, List<String> previous) {
        int score = 0;
        if (input.isBlank() || input.split("\\s+").length <= 2) {
            score += 2;
        }
        if (containsAny(lowered, EVASIVE_PHRASES)) {
            score += 2;
        }
        if (containsAny(lowered, HOSTILE_TERMS)) {
            score += 3;
        }
        if (containsAny(lowered, SELF_CORRECTIONS)) {
            score += 1;
        }
        int from = Math.max(0, previous.size() - 3);
        for (String earlier : previous.subList(from, previous.size())) {
            if (earlier != null && earlier.trim().equalsIgnoreCase(input)) {
                score += 2;
                break;
            }
        }
        return Math.min(score, 10);
    }

    private List<Integer> years(String input) {
        Set<Integer> years = new LinkedHashSet<>();
        Matcher matcher = YEAR_PATTERN.matcher(input);
        while (matcher.find()) {
            years.add(Integer.parseInt(matcher.group()));
        }
        return years.stream().sorted().toList();
    }

    private String employer(String input) {
        Matcher matcher = EMPLOYER_PATTERN.matcher(input);
        if (!matcher.find()) {
            return null;
        }
        return untilStopword(matcher.group(1));
    }

    private String name(String input) {
        Matcher matcher = NAME_PATTERN.matcher(input);
        if (!matcher.find()) {
            return null;
        }
        String raw = untilStopword(matcher.group(1));
        if (raw == null) {
            return null;
        }
        List<String> words = new ArrayList<>();
        for (String word : raw.split("\\s+")) {
            words.add(capitalize(word.toLowerCase(Locale.ROOT)));
        }
        return String.join(" ", words);
    }

    private String school(String input, String lowered) {
        String keyword = firstKeyword(lowered, SCHOOL_KEYWORDS);
        if (keyword == null) {
            return null;
        }
        String[] words = input.split("\\s+");
        for (int i = 0; i < words.length; i++) {
            if (words[i].toLowerCase(Locale.ROOT).contains(keyword)) {
                int start = i;
                while (start > 0 && start > i - 3 && !words[start - 1].isEmpty()
                    && Character.isUpperCase(words[start - 1].charAt(0))) {
                    start--;
                }
                StringBuilder phrase = new StringBuilder();
                for (int j = start; j <= i; j++) {
                    if (phrase.length() > 0) {
                        phrase.append(' ');
                    }
                    phrase.append(words[j]);
                }
                return stripPunctuation(phrase.toString());
            }
        }
        return null;
    }

    private String untilStopword(String phrase) {
        List<String> kept = new ArrayList<>();
        for (String word : phrase.trim().split("\\s+")) {
            String cleaned = stripPunctuation(word);
            if (cleaned.isEmpty() || PHRASE_STOPWORDS.contains(cleaned.toLowerCase(Locale.ROOT))
                || YEAR_PATTERN.matcher(cleaned).matches()) {
                break;
            }
            kept.add(cleaned);
            if (!word.equals(cleaned) && (word.endsWith(",") || word.endsWith("."))) {
                break;
            }
        }
        return kept.isEmpty() ? null : String.join(" ", kept);
    }

    private static String stripPunctuation(String value) {
        return value.replaceAll("^[^A-Za-z0-9&]+|[^A-Za-z0-9&]+$", "");
    }

    private static boolean containsAny(String lowered, List<String> terms) {
        return firstKeyword(lowered, terms) != null;
    }

    private static String firstKeyword(String lowered, List<String> keywords) {
        for (String keyword : keywords) {
            if (containsTerm(lowered, keyword)) {
                return keyword;
            }
        }
        return null;
    }

    private static List<String> allKeywords(String lowered, List<String> keywords) {
        List<String> found = new ArrayList<>();
        for (String keyword : keywords) {
            if (containsTerm(lowered, keyword)) {
                found.add(keyword);
            }
        }
        return found;
    }

    private static boolean containsTerm(String lowered, String term) {
        return Pattern.compile("(?<![a-z])" + Pattern.quote(term) + "(?![a-z])").matcher(lowered).find();
    }

    private static String capitalize(String value) {
        if (value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private static void put(Map<String, List<String>> fields, String name, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        List<String> values = fields.computeIfAbsent(name, ignored -> new ArrayList<>());
        if (!values.contains(value)) {
            values.add(value);
        }
    }
}
