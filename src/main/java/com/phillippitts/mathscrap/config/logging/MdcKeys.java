package com.phillippitts.mathscrap.config.logging;

/** ThreadContext keys referenced by the log pattern in {@code log4j2-spring.xml}. */
public final class MdcKeys {

    public static final String REQUEST_ID = "requestId";
    public static final String JOB_ID = "jobId";
    public static final String IMAGE = "image";

    private MdcKeys() {
    }
}
