package com.psl.orchestrator.summarize;

import com.psl.orchestrator.intent.Classification;
import com.psl.orchestrator.intent.ClassificationRule;
import com.psl.orchestrator.intent.PatternClassifier;
import com.psl.orchestrator.query.QueryParams;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class SummaryDepthClassifier {
    static final int SHORT_QUERY_WORDS = 5;

    private static final Pattern QUESTION_WORD =
        Pattern.compile("\\b(what|how|why|which|where|when)\\b", Pattern.CASE_INSENSITIVE);

    static final List<ClassificationRule<SummaryDepth>> RULES = List.of(
        ClassificationRule.of(SummaryDepth.FULL, 0.95)
            .anyCase(
                "\\bextract\\s+all\\s+\\w+",
                "\\bget\\s+(the\\s+)?(complete|full|entire|raw)\\s+text\\b",
                "\\bfull\\s+text\\s+of\\b",
                "\\b(find|get|show)\\s+all\\s+(equations|formulas|figures|tables)\\b",
                "\\bword\\s+count\\b",
                "\\bexport\\s+(the\\s+)?text\\b",
                "\\bget\\s+everything\\b"
            )
            .build(),
        ClassificationRule.of(SummaryDepth.COMPREHENSIVE, 0.90)
            .anyCase(
                "\\bsummarize\\s+(this\\s+)?(paper|article|study)\\s+comprehensively\\b",
                "\\bsummarize\\s+(the\\s+)?entire\\s+(paper|article|study)\\b",
                "\\b(give|provide)\\s+(me\\s+)?a\\s+(complete|full|detailed|thorough)\\s+summary\\b",
                "\\bsummarize\\s+(all|everything)\\b",
                "\\btell\\s+me\\s+everything\\s+about\\s+this\\s+(paper|article|study)\\b",
                "\\b(what|describe)\\s+(are\\s+)?all\\s+(the\\s+)?(aspects|components|sections)\\b"
            )
            .build(),
        ClassificationRule.of(SummaryDepth.QUICK, 0.85)
            .anyCase(
                "\\bwhat\\s+is\\s+this\\s+(paper|article|study|document)\\s+about\\b",
                "\\b(give|show)\\s+(me\\s+)?(an?\\s+)?overview\\b",
                "\\b(give|show)\\s+(me\\s+)?(the\\s+)?abstract\\b",
                "\\bbasic\\s+info(rmation)?\\b",
                "\\bquick\\s+(summary|overview)\\b",
                "\\bwho\\s+(are\\s+)?the\\s+authors?\\b",
                "\\bwhen\\s+was\\s+this\\s+published\\b",
                "\\bwhat\\s+(journal|conference|venue)\\b",
                "\\bcitation\\s+info(rmation)?\\b"
            )
            .build(),
        ClassificationRule.of(SummaryDepth.TARGETED, 0.80)
            .anyCase(
                "\\bwhat\\s+(methodology|method|approach|technique)\\b",
                "\\bhow\\s+did\\s+(they|the\\s+authors)\\b",
                "\\bwhat\\s+(were|are)\\s+the\\s+(main\\s+)?(findings|results|conclusions)\\b",
                "\\bwhat\\s+(data|dataset|sample)\\b",
                "\\bhow\\s+(was|were)\\s+\\w+\\s+(measured|assessed|evaluated|analyzed)\\b",
                "\\bwhat\\s+(statistical|analysis)\\s+methods?\\b",
                "\\bwhat\\s+(limitations|weaknesses)\\b",
                "\\bwhat\\s+implications?\\b",
                "\\bwhat\\s+(theoretical|conceptual)\\s+framework\\b"
            )
            .build()
    );

    private final PatternClassifier<SummaryDepth> classifier =
        new PatternClassifier<>("summary depth", RULES, SummaryDepth.TARGETED, 0.60);

    public Classification<SummaryDepth> classify(String query) {
        if (query == null || query.isBlank()) {
            return Classification.forced(SummaryDepth.QUICK, QueryParams.empty());
        }
        Classification<SummaryDepth> matched = classifier.classify(query);
        if (!matched.isFallback()) {
            return matched;
        }
        if (query.trim().split("\\s+").length <= SHORT_QUERY_WORDS) {
            return new Classification<>(SummaryDepth.QUICK, 0.60, QueryParams.empty(), true);
        }
        if (QUESTION_WORD.matcher(query).find()) {
            return new Classification<>(SummaryDepth.TARGETED, 0.65, QueryParams.empty(), true);
        }
        return matched;
    }
}
