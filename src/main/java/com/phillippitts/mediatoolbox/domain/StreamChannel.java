package com.phillippitts.mediatoolbox.domain;

/**
 * The two output streams of a supervised process.
 */
public enum StreamChannel {
    STDOUT("out"),
    STDERR("err");

    private final String suffix;

    StreamChannel(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Short suffix used in reader thread names ({@code job-<id>-out}).
     */
    public String suffix() {
        return suffix;
    }
}
