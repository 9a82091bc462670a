/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.junit.Before;
import org.junit.Test;

public class ConfigurationTest {

    private Configuration config;

    @Before
    public void beforeEach() {
        config = Configuration.create().with("A", "a")
                .with("B", "b")
                .with("1", "1")
                .build();
    }

    @Test
    public void shouldConvertFromProperties() {
        Properties props = new Properties();
        props.setProperty("A", "a");
        props.setProperty("B", "b");
        config = Configuration.from(props);
        assertThat(config.getString("A")).isEqualTo("a");
        assertThat(config.getString("B")).isEqualTo("b");
        assertThat(config.keys()).containsOnly("A", "B");
    }

    @Test
    public void shouldNotBeModifiedAfterCreation() {
        Properties props = new Properties();
        props.setProperty("1", "one");
        config = Configuration.from(props);

        props.setProperty("1", "newValue");
        assertThat(config.getString("1")).isEqualTo("one");
    }

    @Test
    public void shouldLoadFromStream() throws IOException {
        String content = "output.mode=hql\ngroup.by.type=true\n";
        config = Configuration.load(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
        DdlParserConfig parserConfig = new DdlParserConfig(config);
        assertThat(parserConfig.getOutputMode()).isEqualTo(OutputMode.HQL);
        assertThat(parserConfig.isGroupByType()).isTrue();
        assertThat(parserConfig.isFailOnError()).isFalse();
    }

    @Test
    public void shouldUseFieldDefaultsWhenKeyIsMissing() {
        assertThat(config.getString(DdlParserConfig.OUTPUT_MODE)).isEqualTo("sql");
        assertThat(config.getBoolean(DdlParserConfig.FAIL_ON_ERROR)).isFalse();
        assertThat(config.hasKey(DdlParserConfig.OUTPUT_MODE)).isFalse();

        DdlParserConfig defaults = DdlParserConfig.defaults();
        assertThat(defaults.getOutputMode()).isEqualTo(OutputMode.SQL);
        assertThat(defaults.isGroupByType()).isFalse();
    }

    @Test
    public void shouldCopyWhenEditing() {
        Configuration edited = config.edit().with("A", "changed").with("B", null).build();
        assertThat(edited.getString("A")).isEqualTo("changed");
        assertThat(edited.getString("B")).isNull();
        assertThat(edited.getString("1")).isEqualTo("1");
        assertThat(config.getString("A")).isEqualTo("a");
    }

    @Test
    public void shouldValidateParserFields() {
        Configuration valid = Configuration.create()
                .with(DdlParserConfig.OUTPUT_MODE, OutputMode.HQL)
                .with(DdlParserConfig.FAIL_ON_ERROR, true)
                .build();
        List<String> problems = new ArrayList<>();
        assertThat(valid.validateAndRecord(DdlParserConfig.ALL_FIELDS, problems::add)).isTrue();
        assertThat(problems).isEmpty();

        Configuration invalid = Configuration.create()
                .with(DdlParserConfig.OUTPUT_MODE.name(), "xml")
                .with(DdlParserConfig.GROUP_BY_TYPE.name(), "maybe")
                .build();
        assertThat(invalid.validateAndRecord(DdlParserConfig.ALL_FIELDS, problems::add)).isFalse();
        assertThat(problems).hasSize(2);
        assertThat(problems.get(0)).contains("'output.mode'").contains("'xml'").contains("sql, hql");
        assertThat(problems.get(1)).contains("'group.by.type'").contains("'maybe'");
    }
}
