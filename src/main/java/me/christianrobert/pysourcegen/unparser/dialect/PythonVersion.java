package me.christianrobert.pysourcegen.unparser.dialect;

/**
 * Python grammar versions supported by the generator, oldest first.
 * The declaration order is the order of the dialect chain.
 */
public enum PythonVersion {
    PY26(2, 6),
    PY27(2, 7),
    PY30(3, 0),
    PY31(3, 1),
    PY32(3, 2),
    PY33(3, 3),
    PY34(3, 4),
    PY35(3, 5),
    PY36(3, 6);

    private final int major;
    private final int minor;

    PythonVersion(int major, int minor) {
        this.major = major;
        this.minor = minor;
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public String label() {
        return major + "." + minor;
    }

    public boolean isAtLeast(PythonVersion other) {
        return compareTo(other) >= 0;
    }

    public static PythonVersion latest() {
        PythonVersion[] all = values();
        return all[all.length - 1];
    }

    /**
     * Parses a version label such as "3.6" (also accepts "36" and "py36").
     *
     * @throws IllegalArgumentException if the label names no supported version
     */
    public static PythonVersion fromLabel(String label) {
        if (label == null || label.trim().isEmpty()) {
            throw new IllegalArgumentException("Python version cannot be null or empty");
        }
        String normalized = label.trim().toLowerCase();
        if (normalized.startsWith("py")) {
            normalized = normalized.substring(2);
        }
        normalized = normalized.replace(".", "");
        for (PythonVersion version : values()) {
            if (normalized.equals(String.valueOf(version.major) + version.minor)) {
                return version;
            }
        }
        throw new IllegalArgumentException("Unsupported Python version: " + label);
    }

    @Override
    public String toString() {
        return label();
    }
}
