/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection.pgoutput;

import java.time.Instant;

import io.pgmirror.annotation.Immutable;
import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.connector.postgresql.connection.ReplicationMessage;

/**
 * Marks the beginning or the end of a transaction.
 * <p>
 * For {@code BEGIN} the commit position is the final LSN of the transaction and the end position is not known.
 * For {@code COMMIT} both are set; the end position is where decoding continues after the transaction and is the
 * position that gets confirmed to the server once the transaction is applied.
 */
@Immutable
public final class TransactionMessage implements ReplicationMessage {

    private final Operation operation;
    private final long transactionId;
    private final Lsn commitLsn;
    private final Lsn endLsn;
    private final Instant commitTime;

    private TransactionMessage(Operation operation, long transactionId, Lsn commitLsn, Lsn endLsn, Instant commitTime) {
        this.operation = operation;
        this.transactionId = transactionId;
        this.commitLsn = commitLsn;
        this.endLsn = endLsn;
        this.commitTime = commitTime;
    }

    public static TransactionMessage begin(long transactionId, Lsn finalLsn, Instant commitTime) {
        return new TransactionMessage(Operation.BEGIN, transactionId, finalLsn, Lsn.INVALID, commitTime);
    }

    public static TransactionMessage commit(Lsn commitLsn, Lsn endLsn, Instant commitTime) {
        return new TransactionMessage(Operation.COMMIT, 0L, commitLsn, endLsn, commitTime);
    }

    @Override
    public Operation getOperation() {
        return operation;
    }

    public long getTransactionId() {
        return transactionId;
    }

    public Lsn getCommitLsn() {
        return commitLsn;
    }

    public Lsn getEndLsn() {
        return endLsn;
    }

    public Instant getCommitTime() {
        return commitTime;
    }

    @Override
    public String toString() {
        return operation == Operation.BEGIN
                ? "BEGIN{xid=" + transactionId + ", finalLsn=" + commitLsn + "}"
                : "COMMIT{commitLsn=" + commitLsn + ", endLsn=" + endLsn + "}";
    }
}
