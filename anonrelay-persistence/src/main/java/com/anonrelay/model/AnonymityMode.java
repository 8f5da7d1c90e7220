package com.anonrelay.model;

/**
 * Who is identified on one endpoint of a thread. Fixed when the thread is created.
 */
public enum AnonymityMode {
    /** I am visible to the peer, the peer is anonymous to me. */
    Me,
    /** The peer is visible to me, I am anonymous to them. */
    Them,
    /** Neither side is identified (random pairing). */
    Both;

    /**
     * @return the mode the peer's mirror endpoint must carry
     */
    public AnonymityMode mirror() {
        switch (this) {
            case Me:
                return Them;
            case Them:
                return Me;
            default:
                return Both;
        }
    }
}
