package com.psl.orchestrator.intent;

/**
 * Regex sources shared by the search and exploration classifiers, so both priority lists recognise the same phrasing.
 * Arrays are handed straight to {@link ClassificationRule.Builder}; callers must not modify them.
 */
final class QueryPatterns {
    static final String[] CITATION = {
        "\\bcit(ing|ation|ed?)\\s+(papers?|chain|network)\\b",
        "\\bpapers?\\s+(citing|that\\s+cite)\\b",
        "\\bcitation\\s+(chain|network|path)\\b",
        "\\b(multi-hop|multihop)\\s+cit"
    };

    static final String[] INFLUENCE = {
        "\\b(seminal|influential|foundational|key|important|highly-cited)\\s+papers?\\b",
        "\\bmost\\s+(influential|cited|important)\\b",
        "\\b(top|best|leading)\\s+papers?\\b",
        "\\bpagerank\\b",
        "\\binfluence\\s+(score|metric|analysis)\\b"
    };

    static final String[] CONTENT_SIMILARITY = {
        "\\b(similar|like|resembling)\\s+(to|this)\\b",
        "\\bmore\\s+(like|similar)\\b",
        "\\bcontent-based\\s+similarit",
        "\\bsemantically\\s+similar\\b",
        "\\b(methodology|approach)\\s+similar\\b"
    };

    // Case-sensitive: the identifier itself is upper case.
    static final String[] SIMILAR_TO_PAPER_ID = {
        "\\b[Pp]apers?\\s+(like|similar\\s+to)\\s+[A-Z0-9]{8}\\b"
    };

    static final String[] COLLABORATION = {
        "\\bcollaborat\\w*\\b",
        "\\bco-author",
        "\\bco author\\b",
        "\\b(worked|works|working)\\s+with\\b",
        "\\bauthorship\\s+network\\b",
        "\\bwho\\s+(did|does)\\s+\\w+\\s+(work|collaborate)\\s+with\\b"
    };

    static final String[] TEMPORAL = {
        "\\b(evolv(e|ed|ing|ution)|develop(ed|ment)|progress(ed|ion))\\b.*\\b(from|since|over|between)\\b.*\\d{4}",
        "\\btrack\\w*\\b.*\\b(over\\s+time|temporal|chronological|historical)\\b",
        "\\bhow\\s+(did|has)\\b.*\\b(chang(e|ed)|evolv(e|ed)|develop(ed))\\b",
        "\\b(trend|trajectory|timeline)\\b.*\\d{4}",
        "\\bfrom\\s+\\d{4}\\s+to\\s+\\d{4}\\b"
    };

    static final String[] CONCEPT_NETWORK = {
        "\\bconcepts?\\s+(related|connected)\\s+to\\b",
        "\\b(related|connected)\\s+concepts?\\b",
        "\\bconcept\\s+(network|propagation|relationships?)\\b",
        "\\b(intermediate|bridging)\\s+concepts?\\b"
    };

    static final String[] VENUE = {
        "\\b(journal|conference|venue|publication\\s+outlet)s?\\b",
        "\\bwhere\\s+(was|were|are|is)\\b.*\\bpublished\\b",
        "\\bpublication\\s+(venue|outlet|pattern)s?\\b"
    };

    private QueryPatterns() {
    }
}
