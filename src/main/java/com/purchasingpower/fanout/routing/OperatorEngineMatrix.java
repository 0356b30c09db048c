package com.purchasingpower.fanout.routing;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Static operator → engine layer table.
 *
 * <p>Keys are qualified operator names as produced by {@link OperatorGrammar#qualifiedName()}.
 * Every operator in the grammar has a row; layers may be empty for operators that only
 * shape the query text and have no preferred source.
 */
public final class OperatorEngineMatrix {

    private static final Map<String, LayerRow> MATRIX = Map.ofEntries(
            // SUBJECT
            entry("SUBJECT.person", row(Set.of("GO", "BI", "BR"), Set.of("YA", "DD", "EX"), Set.of("SS", "BO", "AL"))),
            entry("SUBJECT.company", row(Set.of("GO", "BI", "EX"), Set.of("BR", "YA", "NA"), Set.of("AL", "GD", "AR"))),
            entry("SUBJECT.username", row(Set.of("GO", "BR"), Set.of("DD", "SS"), Set.of("BO", "PW"))),

            // OBJECT
            entry("OBJECT.proximity", row(Set.of("GO", "BI"), Set.of("YA"), Set.of())),
            entry("OBJECT.not", row(Set.of("GO", "BI", "DD"), Set.of("BR", "YA"), Set.of())),
            entry("OBJECT.or", row(Set.of("GO", "BI"), Set.of("BR", "YA", "DD"), Set.of())),
            entry("OBJECT.translation", row(Set.of("GO", "YA"), Set.of("BI", "BA"), Set.of())),
            entry("OBJECT.variation", row(Set.of("GO", "BI"), Set.of("BR"), Set.of())),
            entry("OBJECT.handshake", row(Set.of("GO", "EX"), Set.of("BI"), Set.of("AL"))),
            entry("OBJECT.wildcard", row(Set.of("GO"), Set.of("BI"), Set.of())),

            // LOCATION.temporal
            entry("LOCATION.temporal.date", row(Set.of("GO", "BI"), Set.of("NA", "GD"), Set.of("AR"))),
            entry("LOCATION.temporal.date_range", row(Set.of("GO", "BI"), Set.of("NA", "GD"), Set.of("AR"))),
            entry("LOCATION.temporal.event", row(Set.of("NA", "GD"), Set.of("GO", "BI"), Set.of("AR"))),

            // LOCATION.geographic
            entry("LOCATION.geographic.site", row(Set.of("GO", "BI", "BR"), Set.of("DD", "YA"), Set.of("AR"))),
            entry("LOCATION.geographic.address", row(Set.of("GO", "BI"), Set.of("YA", "BA"), Set.of("GD"))),
            entry("LOCATION.geographic.language", row(Set.of("GO", "YA"), Set.of("BI", "BA"), Set.of("GD"))),

            // LOCATION.textual
            entry("LOCATION.textual.intitle", row(Set.of("GO", "BI"), Set.of("YA", "DD"), Set.of())),
            entry("LOCATION.textual.author", row(Set.of("GO", "SE"), Set.of("CR", "OA"), Set.of("OL", "BK"))),
            entry("LOCATION.textual.anchor", row(Set.of("GO", "BI"), Set.of("YA"), Set.of())),

            // LOCATION.address
            entry("LOCATION.address.inurl", row(Set.of("GO", "BI"), Set.of("YA", "DD"), Set.of("PW"))),
            entry("LOCATION.address.indom", row(Set.of("GO", "BI"), Set.of("YA"), Set.of("PW"))),
            entry("LOCATION.address.alldom", row(Set.of("GO"), Set.of("BI", "YA"), Set.of("PW", "AR"))),

            // LOCATION.format
            entry("LOCATION.format.filetype", row(Set.of("GO", "BI"), Set.of("YA", "DD"), Set.of("AR"))),
            entry("LOCATION.format.pdf", row(Set.of("GO", "BI"), Set.of("YA", "SE"), Set.of("AR", "CR"))),
            entry("LOCATION.format.document", row(Set.of("GO", "BI"), Set.of("YA"), Set.of("AR"))),
            entry("LOCATION.format.image", row(Set.of("GO", "BI"), Set.of("YA"), Set.of())),
            entry("LOCATION.format.audio", row(Set.of("GO"), Set.of("BI"), Set.of("AR"))),
            entry("LOCATION.format.video", row(Set.of("GO", "BI"), Set.of("YA"), Set.of("AR"))),
            entry("LOCATION.format.code", row(Set.of("GO", "PW"), Set.of("BI", "EX"), Set.of())),

            // LOCATION.category
            entry("LOCATION.category.news", row(Set.of("NA", "GD"), Set.of("GO", "BI"), Set.of("AR"))),
            entry("LOCATION.category.academic", row(Set.of("SE", "OA", "CR"), Set.of("AX", "PM"), Set.of("GO"))),
            entry("LOCATION.category.social", row(Set.of("SS"), Set.of("GO", "BR"), Set.of("BO"))),
            entry("LOCATION.category.forum", row(Set.of("BO"), Set.of("GO", "BI"), Set.of("SS"))),
            entry("LOCATION.category.book", row(Set.of("OL", "BK"), Set.of("GU", "GO"), Set.of("LG", "AA")))
    );

    private OperatorEngineMatrix() {
    }

    /**
     * @return engine codes for the operator at the given layer, empty when the operator is unknown
     */
    public static Set<String> engines(String qualifiedOperator, EngineLayer layer) {
        LayerRow row = MATRIX.get(qualifiedOperator);
        if (row == null) {
            return Set.of();
        }
        return switch (layer) {
            case L1 -> row.l1();
            case L2 -> row.l2();
            case L3 -> row.l3();
        };
    }

    public static boolean contains(String qualifiedOperator) {
        return MATRIX.containsKey(qualifiedOperator);
    }

    private static LayerRow row(Set<String> l1, Set<String> l2, Set<String> l3) {
        return new LayerRow(l1, l2, l3);
    }

    private record LayerRow(Set<String> l1, Set<String> l2, Set<String> l3) {
    }
}
