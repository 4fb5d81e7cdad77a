package org.genebuild.genemerge.tools.merge;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import htsjdk.tribble.annotation.Strand;
import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.genemodel.Exon;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Decides whether a manual and an automatic transcript of the same gene describe the same model.
 *
 * The decision is an ordered table of rules; the first rule whose predicate holds gives the outcome. Exons are
 * compared position by position in transcription order, so "first" and "last" exon refer to the 5' and 3' ends.
 */
public final class TranscriptPairMatcher {

    /**
     * The outcome of matching a pair and the rule that produced it.
     */
    public static final class MatchDecision {
        private final MatchOutcome outcome;
        private final String ruleName;
        private final boolean demotesSecond;

        MatchDecision(final MatchOutcome outcome, final String ruleName, final boolean demotesSecond) {
            this.outcome = outcome;
            this.ruleName = ruleName;
            this.demotesSecond = demotesSecond;
        }

        public MatchOutcome getOutcome() {
            return outcome;
        }

        public String getRuleName() {
            return ruleName;
        }

        /**
         * @return true if, when applied, the second (automatic, coding) transcript loses its translation and takes
         * the biotype of the first (manual, non-coding) one, which is dropped
         */
        public boolean demotesSecond() {
            return demotesSecond;
        }

        @Override
        public String toString() {
            return outcome + " (" + ruleName + ")";
        }
    }

    /**
     * The two transcripts under comparison with their exons and coding exons, computed once.
     */
    @VisibleForTesting
    static final class TranscriptPair {
        final Transcript first;
        final Transcript second;
        final List<Exon> firstExons;
        final List<Exon> secondExons;
        final List<Exon> firstCoding;
        final List<Exon> secondCoding;

        TranscriptPair(final Transcript first, final Transcript second) {
            this.first = first;
            this.second = second;
            this.firstExons = first.getExons();
            this.secondExons = second.getExons();
            this.firstCoding = first.getTranslateableExons();
            this.secondCoding = second.getTranslateableExons();
        }

        boolean bothNonCoding() {
            return !first.isCoding() && !second.isCoding();
        }

        boolean onlyFirstCoding() {
            return first.isCoding() && !second.isCoding();
        }

        boolean onlySecondCoding() {
            return !first.isCoding() && second.isCoding();
        }

        boolean bothCoding() {
            return first.isCoding() && second.isCoding();
        }

        boolean bothCodingSingleExon() {
            return bothCoding() && firstExons.size() == 1;
        }

        boolean bothCodingMultiExon() {
            return bothCoding() && firstExons.size() > 1;
        }

        boolean onStrand(final Strand strand) {
            return first.getStrand() == strand;
        }

        Exon firstExonOf(final List<Exon> exons) {
            return exons.get(0);
        }

        Exon lastExonOf(final List<Exon> exons) {
            return exons.get(exons.size() - 1);
        }

        /** Forward strand: the terminal exons of the second transcript begin and end its translation, so it has no UTR. */
        boolean secondHasNoForwardUtr() {
            return firstExonOf(secondExons).getStart() == firstExonOf(secondCoding).getStart() &&
                    lastExonOf(secondExons).getEnd() == lastExonOf(secondCoding).getEnd();
        }

        boolean secondHasNoReverseUtr() {
            return lastExonOf(secondExons).getStart() == lastExonOf(secondCoding).getStart() &&
                    firstExonOf(secondExons).getEnd() == firstExonOf(secondCoding).getEnd();
        }

        /** Forward strand: the pair shares the inner (splice site) boundaries of both terminal exons. */
        boolean forwardSpliceSitesMatch() {
            return firstExonOf(firstExons).getEnd() == firstExonOf(secondExons).getEnd() &&
                    lastExonOf(firstExons).getStart() == lastExonOf(secondExons).getStart();
        }

        boolean reverseSpliceSitesMatch() {
            return firstExonOf(firstExons).getStart() == firstExonOf(secondExons).getStart() &&
                    lastExonOf(firstExons).getEnd() == lastExonOf(secondExons).getEnd();
        }

        /** Forward strand: the outer boundaries of the terminal exons are not all the same. */
        boolean forwardOuterBoundariesDiffer() {
            return lastExonOf(firstExons).getEnd() != lastExonOf(secondExons).getEnd() ||
                    firstExonOf(firstExons).getStart() != firstExonOf(secondExons).getStart();
        }

        boolean reverseOuterBoundariesDiffer() {
            return firstExonOf(firstExons).getEnd() != firstExonOf(secondExons).getEnd() ||
                    lastExonOf(firstExons).getStart() != lastExonOf(secondExons).getStart();
        }
    }

    private static final class Rule {
        final String name;
        final Predicate<TranscriptPair> applies;
        final MatchOutcome outcome;
        final boolean demotesSecond;

        Rule(final String name, final Predicate<TranscriptPair> applies, final MatchOutcome outcome, final boolean demotesSecond) {
            this.name = name;
            this.applies = applies;
            this.outcome = outcome;
            this.demotesSecond = demotesSecond;
        }

        Rule(final String name, final Predicate<TranscriptPair> applies, final MatchOutcome outcome) {
            this(name, applies, outcome, false);
        }
    }

    private static final List<Rule> RULES = ImmutableList.of(
            new Rule("exon-count-differs",
                    p -> p.firstExons.size() != p.secondExons.size(),
                    MatchOutcome.KEEP_BOTH),
            new Rule("strand-differs",
                    p -> p.first.getStrand() != p.second.getStrand() || !p.first.getContig().equals(p.second.getContig()),
                    MatchOutcome.KEEP_BOTH),

            // neither transcript is coding
            new Rule("non-coding-internal-structure-differs",
                    p -> p.bothNonCoding() && !internalStructureMatches(p.secondExons, p.firstExons),
                    MatchOutcome.KEEP_BOTH),
            new Rule("non-coding-first-not-shorter",
                    p -> p.bothNonCoding() && spanIsNotContainedIn(p.firstExons, p.secondExons),
                    MatchOutcome.DROP_SECOND),
            new Rule("non-coding-second-longer",
                    TranscriptPair::bothNonCoding,
                    MatchOutcome.DROP_FIRST),

            // only the manual transcript is coding
            new Rule("coding-first-internal-structure-differs",
                    p -> p.onlyFirstCoding() && !internalStructureMatches(p.secondExons, p.firstCoding),
                    MatchOutcome.KEEP_BOTH),
            new Rule("coding-first-preferred",
                    TranscriptPair::onlyFirstCoding,
                    MatchOutcome.DROP_SECOND),

            // only the automatic transcript is coding
            new Rule("coding-second-internal-structure-differs",
                    p -> p.onlySecondCoding() && p.firstExons.size() > 1 && !internalStructureMatches(p.firstExons, p.secondExons),
                    MatchOutcome.KEEP_BOTH),
            new Rule("coding-second-within-non-coding-first",
                    p -> p.onlySecondCoding() && spanIsNotContainedIn(p.firstExons, p.secondCoding),
                    MatchOutcome.DROP_FIRST, true),
            new Rule("non-coding-first-shorter-than-coding-second",
                    TranscriptPair::onlySecondCoding,
                    MatchOutcome.DROP_SECOND),

            // both coding
            new Rule("coding-boundaries-differ",
                    p -> p.bothCoding() && (p.first.getCodingRegionStart() != p.second.getCodingRegionStart() ||
                            p.first.getCodingRegionEnd() != p.second.getCodingRegionEnd()),
                    MatchOutcome.KEEP_BOTH),

            // both coding, one exon each
            new Rule("single-exon-identical",
                    p -> p.bothCodingSingleExon() &&
                            p.firstExons.get(0).hasSameCoordinates(p.secondExons.get(0)) &&
                            p.firstCoding.get(0).hasSameCoordinates(p.secondCoding.get(0)),
                    MatchOutcome.DROP_SECOND),
            new Rule("single-exon-first-adds-utr",
                    p -> p.bothCodingSingleExon() &&
                            p.firstExons.get(0).getStart() <= p.secondExons.get(0).getStart() &&
                            p.firstExons.get(0).getEnd() >= p.secondExons.get(0).getEnd() &&
                            p.secondExons.get(0).hasSameCoordinates(p.secondCoding.get(0)),
                    MatchOutcome.DROP_SECOND),
            new Rule("single-exon-both-have-utr",
                    p -> p.bothCodingSingleExon() &&
                            !p.firstExons.get(0).hasSameCoordinates(p.secondExons.get(0)) &&
                            !p.secondExons.get(0).hasSameCoordinates(p.secondCoding.get(0)),
                    MatchOutcome.DROP_FIRST),
            new Rule("single-exon-unresolved",
                    TranscriptPair::bothCodingSingleExon,
                    MatchOutcome.KEEP_BOTH),

            // both coding, several exons each
            new Rule("internal-coding-exons-differ",
                    p -> p.bothCodingMultiExon() && !internalExonsMatch(p.firstCoding, p.secondCoding),
                    MatchOutcome.KEEP_BOTH),
            new Rule("internal-utr-exons-differ",
                    p -> p.bothCodingMultiExon() && !internalExonsMatch(p.firstExons, p.secondExons),
                    MatchOutcome.LINK),
            new Rule("terminal-exons-identical",
                    p -> p.bothCodingMultiExon() &&
                            p.firstExonOf(p.firstExons).hasSameCoordinates(p.firstExonOf(p.secondExons)) &&
                            p.lastExonOf(p.firstExons).hasSameCoordinates(p.lastExonOf(p.secondExons)),
                    MatchOutcome.DROP_SECOND),
            new Rule("forward-only-first-has-utr",
                    p -> p.bothCodingMultiExon() && p.onStrand(Strand.POSITIVE) && p.forwardSpliceSitesMatch() &&
                            p.secondHasNoForwardUtr() && p.forwardOuterBoundariesDiffer(),
                    MatchOutcome.DROP_SECOND),
            new Rule("forward-both-have-different-utr",
                    p -> p.bothCodingMultiExon() && p.onStrand(Strand.POSITIVE) && p.forwardSpliceSitesMatch() &&
                            !p.secondHasNoForwardUtr() && p.forwardOuterBoundariesDiffer(),
                    MatchOutcome.DROP_FIRST),
            new Rule("reverse-only-first-has-utr",
                    p -> p.bothCodingMultiExon() && p.onStrand(Strand.NEGATIVE) && p.reverseSpliceSitesMatch() &&
                            p.secondHasNoReverseUtr() && p.reverseOuterBoundariesDiffer(),
                    MatchOutcome.DROP_SECOND),
            new Rule("reverse-both-have-different-utr",
                    p -> p.bothCodingMultiExon() && p.onStrand(Strand.NEGATIVE) && p.reverseSpliceSitesMatch() &&
                            !p.secondHasNoReverseUtr() && p.reverseOuterBoundariesDiffer(),
                    MatchOutcome.DROP_FIRST),
            new Rule("same-coding-different-terminal-structure",
                    TranscriptPair::bothCodingMultiExon,
                    MatchOutcome.LINK)
    );

    /**
     * @param manual the transcript of the manual annotation
     * @param automatic the transcript of the automatic annotation
     */
    public MatchDecision match(final Transcript manual, final Transcript automatic) {
        Utils.nonNull(manual);
        Utils.nonNull(automatic);
        final TranscriptPair pair = new TranscriptPair(manual, automatic);
        for (final Rule rule : RULES) {
            if (rule.applies.test(pair)) {
                return new MatchDecision(rule.outcome, rule.name, rule.demotesSecond);
            }
        }
        // every combination of coding states ends with a catch-all rule
        throw new IllegalStateException("no matching rule for " + manual + " and " + automatic);
    }

    @VisibleForTesting
    static List<String> getRuleNames() {
        return RULES.stream().map(r -> r.name).collect(Collectors.toList());
    }

    /**
     * Two exon lists share their internal structure when they have the same length, every internal exon has the same
     * coordinates in both, and the splice site sides of the terminal exons agree. Single exons must be identical.
     */
    @VisibleForTesting
    static boolean internalStructureMatches(final List<Exon> exons1, final List<Exon> exons2) {
        if (exons1.size() != exons2.size() || exons1.get(0).getStrand() != exons2.get(0).getStrand()) {
            return false;
        }
        final Exon first1 = exons1.get(0);
        final Exon first2 = exons2.get(0);
        final Exon last1 = exons1.get(exons1.size() - 1);
        final Exon last2 = exons2.get(exons2.size() - 1);
        final boolean spliceSitesMatch = first1.getStrand() == Strand.POSITIVE ?
                first1.getEnd() == first2.getEnd() && last1.getStart() == last2.getStart() :
                first1.getStart() == first2.getStart() && last1.getEnd() == last2.getEnd();
        return spliceSitesMatch && internalExonsMatch(exons1, exons2);
    }

    /**
     * @return true if both lists have the same length and every exon but the first and last has the same
     * coordinates in both
     */
    @VisibleForTesting
    static boolean internalExonsMatch(final List<Exon> exons1, final List<Exon> exons2) {
        if (exons1.size() != exons2.size()) {
            return false;
        }
        for (int i = 1; i < exons1.size() - 1; i++) {
            if (!exons1.get(i).hasSameCoordinates(exons2.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return false only if the span of {@code exons1} lies within the span of {@code exons2} and is strictly
     * shorter, i.e. {@code exons2} extends further on at least one side and nowhere less
     */
    @VisibleForTesting
    static boolean spanIsNotContainedIn(final List<Exon> exons1, final List<Exon> exons2) {
        if (exons1.get(0).getStrand() != exons2.get(0).getStrand()) {
            return true;
        }
        final int low1 = exons1.stream().mapToInt(Exon::getStart).min().getAsInt();
        final int high1 = exons1.stream().mapToInt(Exon::getEnd).max().getAsInt();
        final int low2 = exons2.stream().mapToInt(Exon::getStart).min().getAsInt();
        final int high2 = exons2.stream().mapToInt(Exon::getEnd).max().getAsInt();
        final boolean contained = low1 >= low2 && high1 <= high2;
        final boolean equal = low1 == low2 && high1 == high2;
        return !contained || equal;
    }
}
