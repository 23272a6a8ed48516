package org.smileyface.riskcrawler.model;

/**
 * What a target identifier points at.
 */
public enum TargetKind {
    /** A web page addressed by an http(s) URL. */
    PAGE,

    /** A public messaging channel addressed by its handle. */
    CHANNEL
}
