package software.amazon.ahocorasick;

/**
 * A RuntimeException that indicates the dictionary handed to the automaton builder can't be compiled.
 */
public class BuildException extends RuntimeException {

    public BuildException(String msg) {
        super(msg);
    }

    public BuildException(String msg, Throwable cause) {
        super(msg, cause);
    }

}
