package software.amazon.ahocorasick;

/**
 * Thrown when the dictionary contains a zero-length pattern and the configuration does not allow empty patterns.
 */
public class EmptyPatternException extends BuildException {

    private final int patternIndex;

    public EmptyPatternException(int patternIndex) {
        super("Pattern at index " + patternIndex + " is empty");
        this.patternIndex = patternIndex;
    }

    public int getPatternIndex() {
        return patternIndex;
    }

}
