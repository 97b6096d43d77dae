package ai.romantext.harmony.harmony;

/**
 * Major or minor; encoded in key labels by the case of the tonic letter.
 */
public enum KeyMode {
    MAJOR,
    MINOR
}
