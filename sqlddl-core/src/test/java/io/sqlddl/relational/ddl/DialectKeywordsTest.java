/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

import io.sqlddl.relational.ddl.DialectKeywords.Category;

public class DialectKeywordsTest {

    @Test
    public void shouldCategorizeWordsIgnoringCase() {
        assertThat(DialectKeywords.categoryOf("create")).isEqualTo(Category.RESERVED_WORD);
        assertThat(DialectKeywords.categoryOf("VarChar")).isEqualTo(Category.TYPE_NAME);
        assertThat(DialectKeywords.categoryOf("tblproperties")).isEqualTo(Category.DIALECT_CLAUSE_WORD);
        assertThat(DialectKeywords.categoryOf("customers")).isEqualTo(Category.NONE);
    }

    @Test
    public void shouldAnswerCategoryPredicates() {
        assertThat(DialectKeywords.isReservedWord("PRIMARY")).isTrue();
        assertThat(DialectKeywords.isTypeName("BIGINT")).isTrue();
        assertThat(DialectKeywords.isDialectClauseWord("ENGINE")).isTrue();
        assertThat(DialectKeywords.isDialectClauseWord("PRIMARY")).isFalse();
    }

    @Test
    public void shouldRetypeOnlyUnquotedIdentifiers() {
        assertThat(DialectKeywords.typeOf(DdlTokenizer.IDENTIFIER, "TABLE")).isEqualTo(DdlTokenizer.KEYWORD);
        assertThat(DialectKeywords.typeOf(DdlTokenizer.IDENTIFIER, "ORDERS")).isEqualTo(DdlTokenizer.IDENTIFIER);
        assertThat(DialectKeywords.typeOf(DdlTokenizer.QUOTED_IDENTIFIER, "TABLE")).isEqualTo(DdlTokenizer.QUOTED_IDENTIFIER);
    }
}
