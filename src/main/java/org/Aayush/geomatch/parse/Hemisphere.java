package org.Aayush.geomatch.parse;

/**
 * Hemisphere letter carried by a coordinate token.
 */
public enum Hemisphere {
    NORTH('N', Axis.LATITUDE, 1),
    SOUTH('S', Axis.LATITUDE, -1),
    EAST('E', Axis.LONGITUDE, 1),
    WEST('W', Axis.LONGITUDE, -1);

    /**
     * Coordinate axis a hemisphere letter belongs to.
     */
    public enum Axis {
        LATITUDE,
        LONGITUDE
    }

    private final char letter;
    private final Axis axis;
    private final int sign;

    Hemisphere(char letter, Axis axis, int sign) {
        this.letter = letter;
        this.axis = axis;
        this.sign = sign;
    }

    public char letter() {
        return letter;
    }

    public Axis axis() {
        return axis;
    }

    /**
     * {@code +1} for N/E, {@code -1} for S/W.
     */
    public int sign() {
        return sign;
    }

    /**
     * Resolves a letter case-insensitively.
     *
     * @throws IllegalArgumentException when the letter is not one of N, S, E, W.
     */
    public static Hemisphere fromLetter(char letter) {
        switch (Character.toUpperCase(letter)) {
            case 'N':
                return NORTH;
            case 'S':
                return SOUTH;
            case 'E':
                return EAST;
            case 'W':
                return WEST;
            default:
                throw new IllegalArgumentException("Unknown hemisphere letter: " + letter);
        }
    }
}
