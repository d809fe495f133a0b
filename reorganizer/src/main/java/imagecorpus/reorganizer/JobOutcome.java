package imagecorpus.reorganizer;

/**
 * Result of running one {@link CopyJob}. A sidecar problem never turns a copied job into a failed one.
 */
public final class JobOutcome {

    public enum Status { COPIED, FAILED }

    public enum SidecarStatus { NONE, COPIED, FAILED }

    private final CopyJob job;
    private final Status status;
    private final SidecarStatus sidecarStatus;
    private final String error;

    private JobOutcome(CopyJob job, Status status, SidecarStatus sidecarStatus, String error) {
        this.job = job;
        this.status = status;
        this.sidecarStatus = sidecarStatus;
        this.error = error;
    }

    static JobOutcome copied(CopyJob job, SidecarStatus sidecar) {
        return new JobOutcome(job, Status.COPIED, sidecar, null);
    }

    static JobOutcome failed(CopyJob job, Throwable error) {
        return new JobOutcome(job, Status.FAILED, SidecarStatus.NONE, describe(error));
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return msg == null ? t.getClass().getSimpleName() : t.getClass().getSimpleName() + ": " + msg;
    }

    public CopyJob getJob() { return job; }
    public Status getStatus() { return status; }
    public SidecarStatus getSidecarStatus() { return sidecarStatus; }
    public boolean isCopied() { return status == Status.COPIED; }

    /** Failure description, null for copied jobs. */
    public String getError() { return error; }

    @Override
    public String toString() {
        return status + " " + job + (error == null ? "" : " (" + error + ")");
    }
}
