package com.purchasingpower.fanout.routing;

import java.util.regex.Pattern;

import static com.purchasingpower.fanout.routing.LocationDimension.ADDRESS;
import static com.purchasingpower.fanout.routing.LocationDimension.CATEGORY;
import static com.purchasingpower.fanout.routing.LocationDimension.FORMAT;
import static com.purchasingpower.fanout.routing.LocationDimension.GEOGRAPHIC;
import static com.purchasingpower.fanout.routing.LocationDimension.TEMPORAL;
import static com.purchasingpower.fanout.routing.LocationDimension.TEXTUAL;
import static com.purchasingpower.fanout.routing.OperatorFamily.LOCATION;
import static com.purchasingpower.fanout.routing.OperatorFamily.OBJECT;
import static com.purchasingpower.fanout.routing.OperatorFamily.SUBJECT;

/**
 * Search DSL grammar: one row per token pattern.
 *
 * <p>Each row names the operator it detects, its family/dimension and which regex group
 * carries the extracted value. Rows with group {@value #FLAG} only record presence. Several rows may
 * share an operator name (e.g. {@code lang:de!} and bare {@code de!}); their values are merged.
 *
 * <p>Rows are evaluated independently, so one query can match any number of them.
 *
 * @since 1.0.0
 */
public enum OperatorGrammar {

    PERSON(SUBJECT, null, "person", "(?i)\\bp:([^:\\s]+)", 1),
    COMPANY(SUBJECT, null, "company", "(?i)\\bc:([^:\\s]+)", 1),
    USERNAME(SUBJECT, null, "username", "(?i)\\busername:([^:\\s]+)", 1),

    PROXIMITY(OBJECT, null, "proximity", "(\\w+)\\s+~(\\d+)\\s+(\\w+)", 0),
    NOT(OBJECT, null, "not", "(?:^|\\s)-(\\w+)", 1),
    OR(OBJECT, null, "or", "\\s(?:OR|/)\\s", -1),
    TRANSLATION(OBJECT, null, "translation", "(?i)\\btr([a-z]{2,3})!", 1),
    VARIATION(OBJECT, null, "variation", "'([^']+)'", 1),
    HANDSHAKE(OBJECT, null, "handshake", "(?i)handshake\\{([^}]+)\\}", 1),
    WILDCARD(OBJECT, null, "wildcard", "\\*+", -1),

    DATE(LOCATION, TEMPORAL, "date", "(?<![\\d-])(\\d{4})!", 1),
    DATE_RANGE(LOCATION, TEMPORAL, "date_range", "\\b(\\d{4}-\\d{4})!", 1),
    EVENT(LOCATION, TEMPORAL, "event", "(?i)\\bevent:", -1),

    SITE(LOCATION, GEOGRAPHIC, "site", "(?i)\\bsite:(\\S+)", 1),
    ADDRESS_CODE(LOCATION, GEOGRAPHIC, "address", "(?i)\\b(?:loc|near):([a-z]{2})!", 1),
    LANGUAGE(LOCATION, GEOGRAPHIC, "language", "(?i)\\b(?:lang|language):([a-z]{2,3})!", 1),
    LANGUAGE_SHORT(LOCATION, GEOGRAPHIC, "language", "(?<![\\w:])([a-z]{2})!", 1),

    INTITLE(LOCATION, TEXTUAL, "intitle", "(?i)\\bintitle:([^:\\s]+)", 1),
    AUTHOR(LOCATION, TEXTUAL, "author", "(?i)\\b(?:author|by):([^:\\s]+)", 1),
    ANCHOR(LOCATION, TEXTUAL, "anchor", "(?i)\\banchor:(\\S+)", 1),

    INURL(LOCATION, ADDRESS, "inurl", "(?i)\\binurl:([^:\\s]+)", 1),
    INDOM(LOCATION, ADDRESS, "indom", "(?i)\\bindom:([^:\\s]+)", 1),
    ALLDOM(LOCATION, ADDRESS, "alldom", "(?i)\\balldom:([^:\\s]+)", 1),

    FILETYPE(LOCATION, FORMAT, "filetype", "(?i)\\bfiletype:([^:\\s]+)", 1),
    PDF(LOCATION, FORMAT, "pdf", "(?i)\\bpdf!", -1),
    DOCUMENT(LOCATION, FORMAT, "document", "(?i)\\b(?:document|doc)!", -1),
    IMAGE(LOCATION, FORMAT, "image", "(?i)\\b(?:image|img)!", -1),
    AUDIO(LOCATION, FORMAT, "audio", "(?i)\\baudio!", -1),
    VIDEO(LOCATION, FORMAT, "video", "(?i)\\b(?:video|vid)!", -1),
    CODE(LOCATION, FORMAT, "code", "(?i)\\b(?:code|programming)!", -1),

    NEWS(LOCATION, CATEGORY, "news", "(?i)\\bnews!", -1),
    ACADEMIC(LOCATION, CATEGORY, "academic", "(?i)\\b(?:academic|scholar)!", -1),
    SOCIAL(LOCATION, CATEGORY, "social", "(?i)\\bsocial!", -1),
    FORUM(LOCATION, CATEGORY, "forum", "(?i)\\bforum!", -1),
    BOOK(LOCATION, CATEGORY, "book", "(?i)\\bbook!", -1);

    /** Value group marker for presence-only operators. */
    public static final int FLAG = -1;

    private final OperatorFamily family;
    private final LocationDimension dimension;
    private final String operatorName;
    private final Pattern pattern;
    private final int valueGroup;

    OperatorGrammar(OperatorFamily family, LocationDimension dimension, String operatorName,
                    String regex, int valueGroup) {
        this.family = family;
        this.dimension = dimension;
        this.operatorName = operatorName;
        this.pattern = Pattern.compile(regex);
        this.valueGroup = valueGroup;
    }

    public OperatorFamily family() {
        return family;
    }

    /**
     * @return dimension for LOCATION operators, {@code null} otherwise
     */
    public LocationDimension dimension() {
        return dimension;
    }

    public String operatorName() {
        return operatorName;
    }

    public Pattern pattern() {
        return pattern;
    }

    public int valueGroup() {
        return valueGroup;
    }

    public boolean isFlag() {
        return valueGroup == FLAG;
    }

    /**
     * Dotted key used by the engine matrix, e.g. {@code SUBJECT.person} or
     * {@code LOCATION.format.filetype}.
     */
    public String qualifiedName() {
        return qualifiedName(family, dimension, operatorName);
    }

    static String qualifiedName(OperatorFamily family, LocationDimension dimension, String operatorName) {
        return dimension == null
                ? family.name() + "." + operatorName
                : family.name() + "." + dimension.key() + "." + operatorName;
    }
}
