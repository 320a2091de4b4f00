/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection.pgoutput;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.annotation.ThreadSafe;
import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.connector.postgresql.connection.ReplicaIdentityInfo.ReplicaIdentity;
import io.pgmirror.connector.postgresql.connection.ReplicationMessage;
import io.pgmirror.connector.postgresql.connection.ReplicationStreamException;
import io.pgmirror.relational.TableId;

/**
 * Decodes the messages of the {@code pgoutput} logical decoding plugin, protocol version 1.
 * <p>
 * The decoder is stateless: relation metadata is not tracked here but handed to the caller as a
 * {@link RelationMessage}, so tuples are returned positionally and it is up to the consumer to match them
 * against the most recent relation of the same id.
 */
@ThreadSafe
public class PgOutputMessageDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PgOutputMessageDecoder.class);

    /**
     * Seconds between the Unix epoch and 2000-01-01T00:00:00Z, the epoch of Postgres timestamps.
     */
    private static final long PG_EPOCH_SECONDS = 946_684_800L;

    public enum MessageType {
        RELATION('R'),
        BEGIN('B'),
        COMMIT('C'),
        INSERT('I'),
        UPDATE('U'),
        DELETE('D'),
        TYPE('Y'),
        ORIGIN('O'),
        TRUNCATE('T'),
        LOGICAL_DECODING_MESSAGE('M');

        private final char code;

        MessageType(char code) {
            this.code = code;
        }

        public char code() {
            return code;
        }

        public static MessageType forType(char type) {
            for (MessageType messageType : values()) {
                if (messageType.code == type) {
                    return messageType;
                }
            }
            throw new ReplicationStreamException("Unsupported message type '" + type + "' in pgoutput stream");
        }
    }

    /**
     * Decode one message.
     *
     * @param buffer the message, positioned at its type byte; the buffer is consumed
     * @return the decoded message; never null
     * @throws ReplicationStreamException if the message is truncated or of unknown type
     */
    public ReplicationMessage decode(ByteBuffer buffer) {
        if (!buffer.hasRemaining()) {
            throw new ReplicationStreamException("Empty pgoutput message");
        }
        final MessageType type = MessageType.forType((char) buffer.get());
        LOGGER.trace("Decoding {} message", type);
        try {
            switch (type) {
                case BEGIN:
                    return decodeBegin(buffer);
                case COMMIT:
                    return decodeCommit(buffer);
                case RELATION:
                    return decodeRelation(buffer);
                case INSERT:
                    return decodeInsert(buffer);
                case UPDATE:
                    return decodeUpdate(buffer);
                case DELETE:
                    return decodeDelete(buffer);
                case TRUNCATE:
                    return decodeTruncate(buffer);
                default:
                    return new NoopMessage(type.code());
            }
        }
        catch (BufferUnderflowException | IndexOutOfBoundsException e) {
            throw new ReplicationStreamException("Truncated " + type + " message", e);
        }
    }

    private TransactionMessage decodeBegin(ByteBuffer buffer) {
        final Lsn finalLsn = Lsn.valueOf(buffer.getLong());
        final Instant commitTime = toInstant(buffer.getLong());
        final long transactionId = Integer.toUnsignedLong(buffer.getInt());
        return TransactionMessage.begin(transactionId, finalLsn, commitTime);
    }

    private TransactionMessage decodeCommit(ByteBuffer buffer) {
        // flags, currently unused by the server
        buffer.get();
        final Lsn commitLsn = Lsn.valueOf(buffer.getLong());
        final Lsn endLsn = Lsn.valueOf(buffer.getLong());
        final Instant commitTime = toInstant(buffer.getLong());
        return TransactionMessage.commit(commitLsn, endLsn, commitTime);
    }

    private RelationMessage decodeRelation(ByteBuffer buffer) {
        final int relationId = buffer.getInt();
        final String schemaName = readString(buffer);
        final String tableName = readString(buffer);
        final ReplicaIdentity replicaIdentity;
        final char identityCode = (char) buffer.get();
        try {
            replicaIdentity = ReplicaIdentity.parse(identityCode);
        }
        catch (IllegalArgumentException e) {
            throw new ReplicationStreamException("Relation " + schemaName + "." + tableName + " has unknown replica identity '" + identityCode + "'", e);
        }
        final int columnCount = Short.toUnsignedInt(buffer.getShort());
        final List<RelationMessage.Column> columns = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            final boolean key = (buffer.get() & 1) != 0;
            final String name = readString(buffer);
            final int typeOid = buffer.getInt();
            final int typeModifier = buffer.getInt();
            columns.add(new RelationMessage.Column(key, name, typeOid, typeModifier));
        }
        return new RelationMessage(relationId, new TableId(schemaName, tableName), replicaIdentity, columns);
    }

    private RowMessage decodeInsert(ByteBuffer buffer) {
        final int relationId = buffer.getInt();
        expectMarker(buffer, 'N', "INSERT");
        return RowMessage.insert(relationId, readTuple(buffer));
    }

    private RowMessage decodeUpdate(ByteBuffer buffer) {
        final int relationId = buffer.getInt();
        char marker = (char) buffer.get();
        TupleData oldTuple = null;
        boolean keyOnly = false;
        if (marker == 'K' || marker == 'O') {
            keyOnly = marker == 'K';
            oldTuple = readTuple(buffer);
            marker = (char) buffer.get();
        }
        if (marker != 'N') {
            throw new ReplicationStreamException("Unexpected tuple marker '" + marker + "' in UPDATE message");
        }
        return RowMessage.update(relationId, oldTuple, keyOnly, readTuple(buffer));
    }

    private RowMessage decodeDelete(ByteBuffer buffer) {
        final int relationId = buffer.getInt();
        final char marker = (char) buffer.get();
        if (marker != 'K' && marker != 'O') {
            throw new ReplicationStreamException("Unexpected tuple marker '" + marker + "' in DELETE message");
        }
        return RowMessage.delete(relationId, readTuple(buffer), marker == 'K');
    }

    private TruncateMessage decodeTruncate(ByteBuffer buffer) {
        final int relationCount = buffer.getInt();
        final int options = buffer.get();
        final List<Integer> relationIds = new ArrayList<>(relationCount);
        for (int i = 0; i < relationCount; i++) {
            relationIds.add(buffer.getInt());
        }
        return new TruncateMessage(relationIds, (options & 1) != 0, (options & 2) != 0);
    }

    private TupleData readTuple(ByteBuffer buffer) {
        final int columnCount = Short.toUnsignedInt(buffer.getShort());
        final List<ColumnValue> values = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            final char kind = (char) buffer.get();
            switch (kind) {
                case 'n':
                    values.add(ColumnValue.nullValue());
                    break;
                case 'u':
                    values.add(ColumnValue.unchangedToast());
                    break;
                case 't':
                    values.add(ColumnValue.of(ColumnValue.Kind.TEXT, readBytes(buffer)));
                    break;
                case 'b':
                    values.add(ColumnValue.of(ColumnValue.Kind.BINARY, readBytes(buffer)));
                    break;
                default:
                    throw new ReplicationStreamException("Unsupported tuple value kind '" + kind + "'");
            }
        }
        return new TupleData(values);
    }

    private static void expectMarker(ByteBuffer buffer, char expected, String messageType) {
        final char marker = (char) buffer.get();
        if (marker != expected) {
            throw new ReplicationStreamException("Unexpected tuple marker '" + marker + "' in " + messageType + " message");
        }
    }

    private static byte[] readBytes(ByteBuffer buffer) {
        final int length = buffer.getInt();
        if (length < 0 || length > buffer.remaining()) {
            throw new ReplicationStreamException("Invalid value length " + length);
        }
        final byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }

    private static String readString(ByteBuffer buffer) {
        final int start = buffer.position();
        int end = start;
        while (buffer.get(end) != 0) {
            end++;
        }
        final byte[] bytes = new byte[end - start];
        buffer.get(bytes);
        // terminator
        buffer.get();
        return new String(bytes, StandardCharsets.UTF_8);
    }

    static Instant toInstant(long pgEpochMicros) {
        final long seconds = Math.floorDiv(pgEpochMicros, 1_000_000L);
        final long micros = Math.floorMod(pgEpochMicros, 1_000_000L);
        return Instant.ofEpochSecond(PG_EPOCH_SECONDS + seconds, micros * 1_000L);
    }

    /**
     * The inverse of {@link #toInstant(long)}.
     */
    public static long toPgEpochMicros(Instant instant) {
        return (instant.getEpochSecond() - PG_EPOCH_SECONDS) * 1_000_000L + instant.getNano() / 1_000L;
    }
}
