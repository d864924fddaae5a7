package software.amazon.ahocorasick;

/**
 * Thrown when the dictionary uses more distinct byte values than the configured alphabet size.
 */
public class AlphabetOverflowException extends BuildException {

    public AlphabetOverflowException(int maxAlphabetSize, int byteValue) {
        super("Byte " + byteValue + " does not fit in an alphabet limited to " + maxAlphabetSize + " symbols");
    }

}
