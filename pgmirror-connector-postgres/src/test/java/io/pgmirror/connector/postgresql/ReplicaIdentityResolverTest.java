/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import io.pgmirror.connector.postgresql.connection.ReplicaIdentityInfo;
import io.pgmirror.connector.postgresql.connection.ReplicaIdentityInfo.ReplicaIdentity;
import io.pgmirror.connector.postgresql.connection.SourceTable;
import io.pgmirror.connector.postgresql.connection.pgoutput.RelationMessage;
import io.pgmirror.destination.UnchangedToastedPlaceholder;
import io.pgmirror.relational.Column;
import io.pgmirror.relational.TableId;

public class ReplicaIdentityResolverTest {

    private static final TableId TABLE = new TableId("public", "orders");

    private final ReplicaIdentityResolver resolver = new ReplicaIdentityResolver();

    private static final List<Column> COLUMNS = Arrays.asList(
            Column.editor().name("tenant").position(1).type("int4", 23).create(),
            Column.editor().name("id").position(2).type("int8", 20).create(),
            Column.editor().name("code").position(3).type("text", 25).create());

    private static SourceTable table(ReplicaIdentityInfo identity, List<String> primaryKey, List<String> identityIndex) {
        return new SourceTable(TABLE, 16384, COLUMNS, identity, primaryKey, identityIndex);
    }

    @Test
    public void shouldUsePrimaryKeyInKeyOrder() {
        final SourceTable table = table(new ReplicaIdentityInfo(ReplicaIdentity.DEFAULT), Arrays.asList("id", "tenant"),
                Collections.emptyList());
        assertThat(resolver.resolve(table)).containsExactly(1, 0);
    }

    @Test
    public void shouldPreferIdentityIndexOverPrimaryKey() {
        final SourceTable table = table(new ReplicaIdentityInfo(ReplicaIdentity.INDEX, "orders_code_idx"), Arrays.asList("id"),
                Arrays.asList("code"));
        assertThat(resolver.resolve(table)).containsExactly(2);
    }

    @Test
    public void shouldUseAllColumnsWithoutKey() {
        assertThat(resolver.resolve(table(new ReplicaIdentityInfo(ReplicaIdentity.DEFAULT), Collections.emptyList(), Collections.emptyList())))
                .containsExactly(0, 1, 2);
        assertThat(resolver.resolve(table(new ReplicaIdentityInfo(ReplicaIdentity.FULL), Arrays.asList("id"), Collections.emptyList())))
                .containsExactly(0, 1, 2);
    }

    @Test
    public void shouldRejectTablesWithoutIdentity() {
        assertThatThrownBy(() -> resolver.resolve(table(new ReplicaIdentityInfo(ReplicaIdentity.NOTHING), Arrays.asList("id"),
                Collections.emptyList())))
                .isInstanceOf(ReplicaIdentityAmbiguityException.class)
                .hasMessage("Rows of table public.orders cannot be identified because its replica identity is NOTHING");
        assertThatThrownBy(() -> resolver.resolve(table(new ReplicaIdentityInfo(ReplicaIdentity.INDEX, "gone_idx"), Arrays.asList("id"),
                Collections.emptyList())))
                .isInstanceOf(ReplicaIdentityAmbiguityException.class)
                .hasMessageContaining("gone_idx does not exist");
    }

    @Test
    public void shouldResolveKeyFlagsOfRelation() {
        final RelationMessage keyed = new RelationMessage(16384, TABLE, ReplicaIdentity.DEFAULT, Arrays.asList(
                new RelationMessage.Column(false, "tenant", 23, -1),
                new RelationMessage.Column(true, "id", 20, -1),
                new RelationMessage.Column(false, "code", 25, -1)));
        assertThat(resolver.resolve(keyed)).containsExactly(1);

        final RelationMessage full = new RelationMessage(16384, TABLE, ReplicaIdentity.FULL, Arrays.asList(
                new RelationMessage.Column(false, "tenant", 23, -1),
                new RelationMessage.Column(false, "id", 20, -1)));
        assertThat(resolver.resolve(full)).containsExactly(0, 1);

        final RelationMessage nothing = new RelationMessage(16384, TABLE, ReplicaIdentity.NOTHING, Collections.emptyList());
        assertThatThrownBy(() -> resolver.resolve(nothing)).isInstanceOf(ReplicaIdentityAmbiguityException.class);
    }

    @Test
    public void shouldExtractIdentityValues() {
        final Object[] row = { 7, 42L, "abc" };
        assertThat(ReplicaIdentityResolver.extractIdentity(row, Arrays.asList(1, 0))).containsExactly(42L, 7);

        final Object[] toasted = { 7, UnchangedToastedPlaceholder.getInstance(), "abc" };
        assertThatThrownBy(() -> ReplicaIdentityResolver.extractIdentity(toasted, Arrays.asList(1)))
                .isInstanceOf(ValueConversionException.class);
    }

    @Test
    public void shouldTellWhetherIdentityKeepsItsColumns() {
        final List<Column> id = Collections.singletonList(COLUMNS.get(1));
        final List<Column> otherType = Collections.singletonList(COLUMNS.get(1).edit().type("int4", 23).create());
        assertThat(ReplicaIdentityResolver.isPureWidening(id, Collections.singletonList(COLUMNS.get(1)))).isTrue();
        assertThat(ReplicaIdentityResolver.isPureWidening(id, otherType)).isFalse();
        assertThat(ReplicaIdentityResolver.isPureWidening(id, COLUMNS.subList(0, 2))).isFalse();
    }
}
