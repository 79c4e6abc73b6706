package io.relay.core.turn;

public final class Titles {
    private static final int MAX_LENGTH = 50;

    private Titles() {
    }

    public static String fromMessage(String content) {
        String clean = content == null ? "" : content.replace('\n', ' ').trim();
        if (clean.length() <= MAX_LENGTH) {
            return clean;
        }
        return clean.substring(0, MAX_LENGTH - 3) + "...";
    }
}
