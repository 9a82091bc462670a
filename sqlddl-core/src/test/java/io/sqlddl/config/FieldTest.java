/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

public class FieldTest {

    @Test
    public void shouldKeepMetadataWhenAddingValidators() {
        Field field = Field.create("some.flag")
                .withDisplayName("Some flag")
                .withDescription("A flag")
                .withDefault(true)
                .withValidation(Field::isBoolean);
        assertThat(field.name()).isEqualTo("some.flag");
        assertThat(field.displayName()).isEqualTo("Some flag");
        assertThat(field.description()).isEqualTo("A flag");
        assertThat(field.defaultValueAsString()).isEqualTo("true");
        assertThat(field.validator()).isNotNull();
    }

    @Test
    public void shouldRunEveryValidator() {
        Field field = Field.create("required.flag")
                .withValidation(Field::isRequired, Field::isBoolean);
        Configuration config = Configuration.create().with("required.flag", " ").build();
        int[] count = new int[1];
        assertThat(field.validate(config, (f, value, message) -> count[0]++)).isFalse();
        assertThat(count[0]).isEqualTo(2);

        config = Configuration.create().with("required.flag", "TRUE").build();
        assertThat(field.validate(config, (f, value, message) -> count[0]++)).isTrue();
        assertThat(count[0]).isEqualTo(2);
    }

    @Test
    public void shouldFindFieldsInSetByName() {
        assertThat(DdlParserConfig.ALL_FIELDS.fieldWithName("output.mode")).isSameAs(DdlParserConfig.OUTPUT_MODE);
        assertThat(DdlParserConfig.ALL_FIELDS.fieldWithName("unknown")).isNull();
        assertThat(DdlParserConfig.ALL_FIELDS.allFieldNames()).containsExactly("output.mode", "group.by.type", "fail.on.error");
    }

    @Test
    public void shouldParseOutputModeIgnoringCase() {
        assertThat(OutputMode.parse(" HQL ")).isEqualTo(OutputMode.HQL);
        assertThat(OutputMode.parse("xml")).isNull();
        assertThat(OutputMode.parse("xml", "sql")).isEqualTo(OutputMode.SQL);
        assertThat(OutputMode.parse(null)).isNull();
    }
}
