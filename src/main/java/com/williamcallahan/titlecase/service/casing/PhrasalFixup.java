package com.williamcallahan.titlecase.service.casing;

/**
 * String-level pass that runs after token casing.
 *
 * <p>Phrase lowercasing has to happen first: a phrase at either end of a title keeps its
 * inner words lowercase while its outermost word is recapitalized by the boundary step
 * ("Out of the Hurly-Burly", "Got off Of").</p>
 */
final class PhrasalFixup {

    private PhrasalFixup() {}

    static String apply(String title, Lexicon lexicon) {
        return capitalizeBoundaryWords(lowercasePhrases(title, lexicon));
    }

    /**
     * Lowercases every whole-word occurrence of each lexicon phrase, in lexicon order.
     */
    static String lowercasePhrases(String title, Lexicon lexicon) {
        String rewritten = title;
        for (PhrasalPreposition phrase : lexicon.phrases()) {
            rewritten = phrase.lowercaseOccurrences(rewritten);
        }
        return rewritten;
    }

    /**
     * Capitalizes the first and last word runs, skipping leading and trailing punctuation.
     * Runs made only of periods and apostrophes, such as a detached ellipsis, are not words.
     * Ordinal-like runs are left as they are.
     */
    static String capitalizeBoundaryWords(String title) {
        int firstStart = -1;
        int firstEnd = -1;
        int index = 0;
        while (index < title.length()) {
            if (!WordCharacters.isWordConstituent(title.charAt(index))) {
                index++;
                continue;
            }
            int end = runEnd(title, index);
            if (hasAlphanumeric(title, index, end)) {
                firstStart = index;
                firstEnd = end;
                break;
            }
            index = end;
        }
        if (firstStart < 0) {
            return title;
        }

        int lastStart = firstStart;
        int lastEnd = firstEnd;
        index = title.length();
        while (index > firstEnd) {
            if (!WordCharacters.isWordConstituent(title.charAt(index - 1))) {
                index--;
                continue;
            }
            int start = runStart(title, index);
            if (hasAlphanumeric(title, start, index)) {
                lastStart = start;
                lastEnd = index;
                break;
            }
            index = start;
        }

        String rewritten = capitalizeRun(title, lastStart, lastEnd);
        return capitalizeRun(rewritten, firstStart, firstEnd);
    }

    private static boolean hasAlphanumeric(String title, int start, int end) {
        for (int index = start; index < end; index++) {
            char current = title.charAt(index);
            if (WordCharacters.isLetter(current) || WordCharacters.isDigit(current)) {
                return true;
            }
        }
        return false;
    }

    private static String capitalizeRun(String title, int start, int end) {
        String run = title.substring(start, end);
        if (TokenClassifier.isOrdinalLike(run)) {
            return title;
        }
        return title.substring(0, start) + WordCharacters.capitalize(run) + title.substring(end);
    }

    private static int runEnd(String title, int start) {
        int end = start;
        while (end < title.length() && WordCharacters.isWordConstituent(title.charAt(end))) {
            end++;
        }
        return end;
    }

    private static int runStart(String title, int end) {
        int start = end;
        while (start > 0 && WordCharacters.isWordConstituent(title.charAt(start - 1))) {
            start--;
        }
        return start;
    }
}
