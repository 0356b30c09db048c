package com.purchasingpower.fanout.recall;

public enum ExpansionType {
    SYNONYMS,
    SEMANTIC,
    MODIFIERS,
    STEMS,
    MISSPELLINGS
}
