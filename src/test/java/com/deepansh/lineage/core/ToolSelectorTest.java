package com.deepansh.lineage.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ToolSelectorTest {

    private final ToolSelector selector = new ToolSelector();

    @ParameterizedTest
    @CsvSource({
            "search_vector_db, search_vector_db",
            "GET_TABLE_DEPENDENCIES, get_table_dependencies",
            "'  Validate_Lineage_Path  ', validate_lineage_path",
            "I would call trace_data_flow first., trace_data_flow",
            "check_data_freshness, check_data_freshness"
    })
    void select_choiceContainingToolName_matchesThatTool(String raw, String expected) {
        assertThat(selector.select(raw)).isEqualTo(expected);
    }

    @Test
    void select_fragmentOfToolName_matchesContainingTool() {
        assertThat(selector.select("dependencies")).isEqualTo("get_table_dependencies");
        assertThat(selector.select("freshness")).isEqualTo("check_data_freshness");
    }

    @Test
    void select_fragmentSharedByTools_firstInVocabularyOrderWins() {
        // "data" occurs in get_node_metadata, trace_data_flow and check_data_freshness
        assertThat(selector.select("data")).isEqualTo("get_node_metadata");
    }

    @Test
    void select_textNamingTwoTools_firstInVocabularyOrderWins() {
        assertThat(selector.select("trace_data_flow then search_vector_db")).isEqualTo("search_vector_db");
    }

    @ParameterizedTest
    @ValueSource(strings = {"query the warehouse", "xyz", "SELECT 1"})
    void select_unrecognized_fallsBackToDefault(String raw) {
        assertThat(selector.select(raw)).isEqualTo("search_vector_db");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\n\t"})
    void select_blank_fallsBackToDefault(String raw) {
        assertThat(selector.select(raw)).isEqualTo("search_vector_db");
    }
}
