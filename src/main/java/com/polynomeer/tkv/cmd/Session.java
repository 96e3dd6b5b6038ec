package com.polynomeer.tkv.cmd;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-connection command state: MULTI queue and its dirty flag.
 */
public final class Session {
    private boolean inTxn;
    private boolean txnDirty;
    private boolean bypassTxn;
    private List<List<String>> txnQueue = new ArrayList<>();

    public boolean isInTxn() {
        return inTxn;
    }

    void beginTxn() {
        inTxn = true;
        txnDirty = false;
        txnQueue = new ArrayList<>();
    }

    void endTxn() {
        inTxn = false;
        txnDirty = false;
        txnQueue = new ArrayList<>();
    }

    void markTxnDirty() {
        txnDirty = true;
    }

    boolean isTxnDirty() {
        return txnDirty;
    }

    void queueTxn(List<String> argv) {
        txnQueue.add(argv);
    }

    List<List<String>> drainTxnQueue() {
        List<List<String>> q = txnQueue;
        txnQueue = new ArrayList<>();
        return q;
    }

    boolean isBypassTxn() {
        return bypassTxn;
    }

    void setBypassTxn(boolean bypass) {
        bypassTxn = bypass;
    }
}
