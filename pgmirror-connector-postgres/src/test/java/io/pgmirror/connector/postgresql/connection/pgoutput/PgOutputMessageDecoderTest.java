/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection.pgoutput;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.junit.Test;

import io.pgmirror.connector.postgresql.connection.Lsn;
import io.pgmirror.connector.postgresql.connection.ReplicaIdentityInfo.ReplicaIdentity;
import io.pgmirror.connector.postgresql.connection.ReplicationMessage;
import io.pgmirror.connector.postgresql.connection.ReplicationMessage.Operation;
import io.pgmirror.connector.postgresql.connection.ReplicationStreamException;
import io.pgmirror.relational.TableId;

public class PgOutputMessageDecoderTest {

    private final PgOutputMessageDecoder decoder = new PgOutputMessageDecoder();

    /**
     * Writes a pgoutput message the way the server lays it out.
     */
    private static final class Frame {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        private final DataOutputStream out = new DataOutputStream(bytes);

        Frame(char type) throws IOException {
            out.writeByte(type);
        }

        Frame int8(int value) throws IOException {
            out.writeByte(value);
            return this;
        }

        Frame int16(int value) throws IOException {
            out.writeShort(value);
            return this;
        }

        Frame int32(int value) throws IOException {
            out.writeInt(value);
            return this;
        }

        Frame int64(long value) throws IOException {
            out.writeLong(value);
            return this;
        }

        Frame string(String value) throws IOException {
            out.write(value.getBytes(StandardCharsets.UTF_8));
            out.writeByte(0);
            return this;
        }

        Frame text(String value) throws IOException {
            final byte[] data = value.getBytes(StandardCharsets.UTF_8);
            out.writeByte('t');
            out.writeInt(data.length);
            out.write(data);
            return this;
        }

        ByteBuffer buffer() throws IOException {
            out.flush();
            return ByteBuffer.wrap(bytes.toByteArray());
        }
    }

    @Test
    public void shouldDecodeBegin() throws Exception {
        final Instant commitTime = Instant.parse("2024-03-01T10:15:30.123456Z");
        final ReplicationMessage message = decode(new Frame('B')
                .int64(0x16B3800L)
                .int64(PgOutputMessageDecoder.toPgEpochMicros(commitTime))
                .int32(751));

        assertThat(message.getOperation()).isEqualTo(Operation.BEGIN);
        final TransactionMessage begin = (TransactionMessage) message;
        assertThat(begin.getTransactionId()).isEqualTo(751L);
        assertThat(begin.getCommitLsn()).isEqualTo(Lsn.valueOf(0x16B3800L));
        assertThat(begin.getCommitTime()).isEqualTo(commitTime);
    }

    @Test
    public void shouldDecodeCommit() throws Exception {
        final TransactionMessage commit = (TransactionMessage) decode(new Frame('C')
                .int8(0)
                .int64(0x16B3800L)
                .int64(0x16B3830L)
                .int64(0L));

        assertThat(commit.getOperation()).isEqualTo(Operation.COMMIT);
        assertThat(commit.getCommitLsn()).isEqualTo(Lsn.valueOf(0x16B3800L));
        assertThat(commit.getEndLsn()).isEqualTo(Lsn.valueOf(0x16B3830L));
        assertThat(commit.getCommitTime()).isEqualTo(Instant.parse("2000-01-01T00:00:00Z"));
    }

    @Test
    public void shouldDecodeRelation() throws Exception {
        final RelationMessage relation = (RelationMessage) decode(new Frame('R')
                .int32(16384)
                .string("public")
                .string("orders")
                .int8('d')
                .int16(2)
                .int8(1).string("id").int32(23).int32(-1)
                .int8(0).string("amount").int32(1700).int32(((10 << 16) | 2) + 4));

        assertThat(relation.getRelationId()).isEqualTo(16384);
        assertThat(relation.getTableId()).isEqualTo(new TableId("public", "orders"));
        assertThat(relation.getReplicaIdentity()).isEqualTo(ReplicaIdentity.DEFAULT);
        assertThat(relation.getColumns()).hasSize(2);
        assertThat(relation.getColumns().get(0).isKey()).isTrue();
        assertThat(relation.getColumns().get(0).name()).isEqualTo("id");
        assertThat(relation.getColumns().get(0).typeOid()).isEqualTo(23);
        assertThat(relation.getColumns().get(1).isKey()).isFalse();
        assertThat(relation.getColumns().get(1).typeModifier()).isEqualTo(655366);
    }

    @Test
    public void shouldDecodeInsertWithAllValueKinds() throws Exception {
        final RowMessage insert = (RowMessage) decode(new Frame('I')
                .int32(16384)
                .int8('N')
                .int16(4)
                .text("42")
                .int8('n')
                .int8('u')
                .text("zaż"));

        assertThat(insert.getOperation()).isEqualTo(Operation.INSERT);
        assertThat(insert.getRelationId()).isEqualTo(16384);
        assertThat(insert.getOldTuple()).isNull();
        final TupleData tuple = insert.getNewTuple();
        assertThat(tuple.size()).isEqualTo(4);
        assertThat(tuple.get(0).asText()).isEqualTo("42");
        assertThat(tuple.get(1).isNull()).isTrue();
        assertThat(tuple.get(2).isUnchangedToast()).isTrue();
        assertThat(tuple.get(3).asText()).isEqualTo("zaż");
    }

    @Test
    public void shouldDecodeUpdateWithKeyTuple() throws Exception {
        final RowMessage update = (RowMessage) decode(new Frame('U')
                .int32(16384)
                .int8('K').int16(2).text("1").int8('n')
                .int8('N').int16(2).text("2").text("b"));

        assertThat(update.getOperation()).isEqualTo(Operation.UPDATE);
        assertThat(update.isOldTupleKeyOnly()).isTrue();
        assertThat(update.getOldTuple().get(0).asText()).isEqualTo("1");
        assertThat(update.getNewTuple().get(1).asText()).isEqualTo("b");
    }

    @Test
    public void shouldDecodeUpdateWithoutOldTuple() throws Exception {
        final RowMessage update = (RowMessage) decode(new Frame('U')
                .int32(16384)
                .int8('N').int16(1).text("2"));

        assertThat(update.getOldTuple()).isNull();
        assertThat(update.getNewTuple().get(0).asText()).isEqualTo("2");
    }

    @Test
    public void shouldDecodeDeleteWithFullOldTuple() throws Exception {
        final RowMessage delete = (RowMessage) decode(new Frame('D')
                .int32(16384)
                .int8('O').int16(2).text("1").text("a"));

        assertThat(delete.getOperation()).isEqualTo(Operation.DELETE);
        assertThat(delete.isOldTupleKeyOnly()).isFalse();
        assertThat(delete.getOldTuple().size()).isEqualTo(2);
        assertThat(delete.getNewTuple()).isNull();
    }

    @Test
    public void shouldDecodeTruncate() throws Exception {
        final TruncateMessage truncate = (TruncateMessage) decode(new Frame('T')
                .int32(2)
                .int8(2)
                .int32(16384)
                .int32(16390));

        assertThat(truncate.getOperation()).isEqualTo(Operation.TRUNCATE);
        assertThat(truncate.getRelationIds()).containsExactly(16384, 16390);
        assertThat(truncate.isCascade()).isFalse();
        assertThat(truncate.isRestartIdentity()).isTrue();
    }

    @Test
    public void shouldIgnoreOriginAndTypeMessages() throws Exception {
        final ReplicationMessage origin = decode(new Frame('O').int64(1L).string("origin"));
        assertThat(origin.getOperation()).isEqualTo(Operation.NOOP);
        assertThat(((NoopMessage) origin).getType()).isEqualTo('O');
        assertThat(decode(new Frame('Y').int32(600).string("public").string("point")).getOperation()).isEqualTo(Operation.NOOP);
    }

    @Test
    public void shouldRejectUnknownMessageType() throws Exception {
        assertThatThrownBy(() -> decode(new Frame('X')))
                .isInstanceOf(ReplicationStreamException.class)
                .hasMessageContaining("Unsupported message type 'X'");
    }

    @Test
    public void shouldRejectTruncatedMessage() throws Exception {
        final Frame frame = new Frame('I').int32(16384).int8('N').int16(2).text("1");
        assertThatThrownBy(() -> decode(frame))
                .isInstanceOf(ReplicationStreamException.class)
                .hasMessageContaining("Truncated INSERT message");
    }

    @Test
    public void shouldRejectUnexpectedTupleMarker() throws Exception {
        final Frame frame = new Frame('D').int32(16384).int8('N').int16(1).text("1");
        assertThatThrownBy(() -> decode(frame))
                .isInstanceOf(ReplicationStreamException.class)
                .hasMessageContaining("Unexpected tuple marker 'N' in DELETE message");
    }

    @Test
    public void shouldRejectUnknownReplicaIdentity() throws Exception {
        final Frame frame = new Frame('R').int32(1).string("public").string("t").int8('x').int16(0);
        assertThatThrownBy(() -> decode(frame))
                .isInstanceOf(ReplicationStreamException.class)
                .hasMessageContaining("unknown replica identity 'x'");
    }

    private ReplicationMessage decode(Frame frame) throws IOException {
        return decoder.decode(frame.buffer());
    }
}
