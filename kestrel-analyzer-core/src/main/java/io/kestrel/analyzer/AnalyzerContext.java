/*
 * AnalyzerContext.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2024 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.kestrel.analyzer;

import com.google.common.base.Preconditions;
import io.kestrel.analyzer.catalog.Catalog;
import io.kestrel.analyzer.catalog.ColumnDescriptor;
import io.kestrel.analyzer.catalog.TableDescriptor;
import io.kestrel.analyzer.expr.AggExpr;
import io.kestrel.analyzer.expr.AggKind;
import io.kestrel.analyzer.expr.BinOper;
import io.kestrel.analyzer.expr.ColumnVar;
import io.kestrel.analyzer.expr.Expr;
import io.kestrel.analyzer.expr.InValues;
import io.kestrel.analyzer.expr.Qualifier;
import io.kestrel.analyzer.expr.SqlOperator;
import io.kestrel.analyzer.logging.KeyValueLogMessage;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.analyzer.query.Query;
import io.kestrel.analyzer.query.RangeTblEntry;
import io.kestrel.analyzer.query.StatementType;
import io.kestrel.analyzer.query.TargetEntry;
import io.kestrel.annotation.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds one {@link Query} against a {@link Catalog}, in the order a statement is analyzed: tables of the
 * {@code FROM} clause first, then the expressions that reference them.
 *
 * <pre>{@code
 * AnalyzerContext context = new AnalyzerContext(catalog, StatementType.SELECT);
 * context.addTable("emp", "e");
 * Expr salary = context.resolveColumn("e", "salary");
 * context.addTarget("total", context.aggregate(AggKind.SUM, salary, false));
 * context.setWhere(context.binary(SqlOperator.GT, salary, Constant.ofString("1000")));
 * Query query = context.finish();
 * }</pre>
 *
 * <p>
 * Aliases are kept in normalized form: lower case unless {@link AnalyzerConfiguration#isIdentifiersCaseSensitive()}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
@NotThreadSafe
public class AnalyzerContext {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzerContext.class);

    @Nonnull
    private final Catalog catalog;
    @Nonnull
    private final AnalyzerConfiguration configuration;
    @Nonnull
    private final Query query;
    private boolean finished;

    public AnalyzerContext(@Nonnull Catalog catalog, @Nonnull StatementType statementType,
                           @Nonnull AnalyzerConfiguration configuration) {
        this.catalog = catalog;
        this.configuration = configuration;
        this.query = new Query();
        query.setStatementType(statementType);
    }

    public AnalyzerContext(@Nonnull Catalog catalog, @Nonnull StatementType statementType) {
        this(catalog, statementType, AnalyzerConfiguration.defaultAnalyzerConfiguration());
    }

    @Nonnull
    public Catalog getCatalog() {
        return catalog;
    }

    @Nonnull
    public AnalyzerConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Get the query being built. It must not be shared with other threads before {@link #finish()}.
     * @return the query
     */
    @Nonnull
    public Query getQuery() {
        return query;
    }

    @Nonnull
    private String normalizeAlias(@Nonnull String alias) {
        return configuration.isIdentifiersCaseSensitive() ? alias : alias.toLowerCase(Locale.ROOT);
    }

    /**
     * Add a base table to the range table.
     * @param tableName name of the table
     * @param alias the alias the table is referenced by, or {@code null} to use its name
     * @return the range table index of the new entry
     * @throws ResolutionException if there is no such table or the alias is already in use
     */
    public int addTable(@Nonnull String tableName, @Nullable String alias) {
        return addTable(tableName, alias, null);
    }

    /**
     * Add a table or view to the range table.
     * @param tableName name of the table or view
     * @param alias the alias the table is referenced by, or {@code null} to use its name
     * @param viewQuery the analyzed query of the view, or {@code null} for a base table
     * @return the range table index of the new entry
     * @throws ResolutionException if there is no such table or the alias is already in use
     */
    public int addTable(@Nonnull String tableName, @Nullable String alias, @Nullable Query viewQuery) {
        checkNotFinished();
        final TableDescriptor table = catalog.lookupTable(tableName).orElseThrow(() ->
                new ResolutionException("table does not exist", ErrorCode.UNDEFINED_TABLE,
                        LogMessageKeys.TABLE_NAME, tableName));
        Preconditions.checkArgument(table.isView() == (viewQuery != null),
                "a view needs its query and a base table must not have one: %s", tableName);
        final String rangeVar = normalizeAlias(alias == null ? table.getName() : alias);
        if (query.findRangeIndex(rangeVar) >= 0) {
            throw new ResolutionException("table alias specified more than once", ErrorCode.DUPLICATE_ALIAS,
                    LogMessageKeys.ALIAS, rangeVar,
                    LogMessageKeys.TABLE_NAME, tableName);
        }
        final int index = query.addRangeTableEntry(new RangeTblEntry(rangeVar, table, viewQuery));
        if (query.getStatementType().hasResultTable() && index == 0) {
            query.setResultTableId(table.getTableId());
        }
        return index;
    }

    /**
     * Resolve a column reference.
     * @param alias the table alias qualifying the column, or {@code null} for an unqualified column
     * @param columnName the column name
     * @return a reference to the column
     * @throws ResolutionException if the alias or column does not exist, or an unqualified column exists in more
     * than one table
     */
    @Nonnull
    public ColumnVar resolveColumn(@Nullable String alias, @Nonnull String columnName) {
        if (alias != null) {
            final int index = query.resolveRangeIndex(normalizeAlias(alias));
            return columnVar(query.getRangeTableEntry(index).resolveColumn(catalog, columnName), index);
        }
        ColumnDescriptor found = null;
        int foundIndex = -1;
        final List<RangeTblEntry> rangeTable = query.getRangeTable();
        for (int i = 0; i < rangeTable.size(); i++) {
            final ColumnDescriptor column = rangeTable.get(i).lookupColumn(catalog, columnName).orElse(null);
            if (column == null) {
                continue;
            }
            if (found != null) {
                throw new ResolutionException("column reference is ambiguous", ErrorCode.AMBIGUOUS_COLUMN,
                        LogMessageKeys.COLUMN_NAME, columnName);
            }
            found = column;
            foundIndex = i;
        }
        if (found == null) {
            throw new ResolutionException("column does not exist", ErrorCode.UNDEFINED_COLUMN,
                    LogMessageKeys.COLUMN_NAME, columnName,
                    LogMessageKeys.RANGE_TABLE_SIZE, rangeTable.size());
        }
        return columnVar(found, foundIndex);
    }

    @Nonnull
    private static ColumnVar columnVar(@Nonnull ColumnDescriptor column, int rangeTableIndex) {
        return new ColumnVar(column.getTypeInfo(), column.getTableId(), column.getColumnId(), rangeTableIndex);
    }

    /**
     * Expand {@code *} or {@code alias.*} into the target list.
     * @param alias the alias to expand, or {@code null} to expand every range table entry in order
     */
    public void expandStar(@Nullable String alias) {
        checkNotFinished();
        final List<TargetEntry> expanded = new ArrayList<>();
        if (alias != null) {
            final int index = query.resolveRangeIndex(normalizeAlias(alias));
            query.getRangeTableEntry(index).expandStar(catalog, expanded, index);
        } else {
            final List<RangeTblEntry> rangeTable = query.getRangeTable();
            for (int i = 0; i < rangeTable.size(); i++) {
                rangeTable.get(i).expandStar(catalog, expanded, i);
            }
        }
        expanded.forEach(query::addTargetEntry);
    }

    public void addTarget(@Nonnull String name, @Nonnull Expr expr) {
        addTarget(name, expr, false);
    }

    public void addTarget(@Nonnull String name, @Nonnull Expr expr, boolean unnest) {
        checkNotFinished();
        query.addTargetEntry(new TargetEntry(name, expr, unnest));
    }

    /**
     * Build a typed binary operation, converting string literals as configured.
     * @param operator a binary operator
     * @param left the left operand
     * @param right the right operand
     * @return the operation
     * @throws TypeException if the operands have no valid common type
     */
    @Nonnull
    public BinOper binary(@Nonnull SqlOperator operator, @Nonnull Expr left, @Nonnull Expr right) {
        return BinOper.create(operator, Qualifier.ONE, left, right, configuration.shouldCoerceStringLiterals());
    }

    @Nonnull
    public InValues in(@Nonnull Expr arg, @Nonnull List<? extends Expr> values) {
        return InValues.create(arg, values, configuration.shouldCoerceStringLiterals());
    }

    /**
     * Build an aggregate call and count it towards the query's aggregates.
     * @param kind the aggregate function
     * @param arg the argument, or {@code null} for {@code COUNT(*)}
     * @param distinct whether duplicate argument values are ignored
     * @return the aggregate call
     */
    @Nonnull
    public AggExpr aggregate(@Nonnull AggKind kind, @Nullable Expr arg, boolean distinct) {
        checkNotFinished();
        final AggExpr aggregate = AggExpr.create(kind, arg, distinct);
        query.setNumAggregates(query.getNumAggregates() + 1);
        return aggregate;
    }

    /**
     * Set the {@code WHERE} clause.
     * @param predicate a boolean condition that does not call aggregates
     * @throws GroupingException if the condition calls an aggregate
     */
    public void setWhere(@Nonnull Expr predicate) {
        checkNotFinished();
        checkPredicate(predicate);
        if (predicate.containsAggregate()) {
            throw new GroupingException("aggregate functions are not allowed in WHERE",
                    LogMessageKeys.EXPR, predicate);
        }
        query.setWhere(predicate);
    }

    /**
     * Set the grouping keys.
     * @param groupBy the keys, none of which may call an aggregate
     * @throws GroupingException if a key calls an aggregate
     */
    public void setGroupBy(@Nonnull List<Expr> groupBy) {
        checkNotFinished();
        for (Expr key : groupBy) {
            if (key.containsAggregate()) {
                throw new GroupingException("aggregate functions are not allowed in GROUP BY",
                        LogMessageKeys.EXPR, key);
            }
        }
        query.setGroupBy(groupBy);
    }

    public void setHaving(@Nonnull Expr predicate) {
        checkNotFinished();
        checkPredicate(predicate);
        query.setHaving(predicate);
    }

    private static void checkPredicate(@Nonnull Expr predicate) {
        if (!predicate.getTypeInfo().isBoolean() && !predicate.getTypeInfo().isNullType()) {
            throw new TypeException("condition must be a boolean expression",
                    LogMessageKeys.EXPR, predicate,
                    LogMessageKeys.TYPE, predicate.getTypeInfo());
        }
    }

    /**
     * Validate the query and hand it over. The context cannot be used afterwards.
     * @return the finished query
     * @throws GroupingException if the query aggregates and uses a column that is neither grouped nor aggregated
     * @throws AnalyzerException if a column refers to a missing range table entry
     */
    @Nonnull
    public Query finish() {
        checkNotFinished();
        query.checkGroupBy();
        if (configuration.shouldCheckRangeTableReferences()) {
            query.checkRangeTableReferences();
        }
        finished = true;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("finished query analysis",
                    LogMessageKeys.STATEMENT_TYPE, query.getStatementType(),
                    LogMessageKeys.RANGE_TABLE_SIZE, query.getRangeTable().size(),
                    LogMessageKeys.TARGET_LIST_SIZE, query.getTargetList().size(),
                    LogMessageKeys.QUERY, query));
        }
        return query;
    }

    private void checkNotFinished() {
        Preconditions.checkState(!finished, "query analysis is already finished");
    }
}
