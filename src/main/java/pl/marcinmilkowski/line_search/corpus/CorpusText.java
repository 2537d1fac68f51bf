package pl.marcinmilkowski.line_search.corpus;

/**
 * The corpus as one string, lines joined by '\n'.
 *
 * @param text      joined lines, no trailing terminator
 * @param lineCount number of lines; distinguishes an empty file (0) from a
 *                  file holding a single empty line (1), which share the same text
 */
public record CorpusText(String text, int lineCount) {

    /**
     * Whether the line starting at {@code start} ends exactly at {@code end}.
     */
    public boolean isWholeLine(int start, int end) {
        return (start == 0 || text.charAt(start - 1) == '\n')
            && (end == text.length() || text.charAt(end) == '\n');
    }

    /**
     * Whether any line of the corpus is empty.
     */
    public boolean hasEmptyLine() {
        if (lineCount == 0) {
            return false;
        }
        return text.isEmpty() || text.charAt(0) == '\n' || text.charAt(text.length() - 1) == '\n'
            || text.contains("\n\n");
    }
}
