package io.stelli.core.migration;

import static io.stelli.core.model.FieldType.DATE;
import static io.stelli.core.model.FieldType.DROPDOWN;
import static io.stelli.core.model.FieldType.MULTI_SELECT;
import static io.stelli.core.model.FieldType.NUMBER;
import static io.stelli.core.model.FieldType.PHOTOS;
import static io.stelli.core.model.FieldType.TEXT;
import static io.stelli.core.model.FieldType.YES_NO;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link FieldValueConverter}. */
class FieldValueConverterTest {

    @ParameterizedTest
    @CsvSource({"yes,true", "TRUE,true", "1,true", "No,false", "false,false", "0,false"})
    @DisplayName("Text answers become booleans, never strings")
    void textToYesNo(String text, boolean expected) {
        assertThat(FieldValueConverter.convert(text, TEXT, YES_NO)).isEqualTo(expected);
    }

    @Test
    void unrecognisedAnswerIsDropped() {
        assertThat(FieldValueConverter.convert("maybe", TEXT, YES_NO)).isNull();
    }

    @Test
    void textToNumberParsesOrDrops() {
        assertThat(FieldValueConverter.convert(" 12.5 ", TEXT, NUMBER)).isEqualTo(12.5);
        assertThat(FieldValueConverter.convert("twelve", TEXT, NUMBER)).isNull();
    }

    @Test
    void numberToTextIsPlain() {
        assertThat(FieldValueConverter.convert(42.0, NUMBER, TEXT)).isEqualTo("42");
        assertThat(FieldValueConverter.convert(0.25, NUMBER, TEXT)).isEqualTo("0.25");
    }

    @Test
    void yesNoToText() {
        assertThat(FieldValueConverter.convert(true, YES_NO, TEXT)).isEqualTo("Yes");
        assertThat(FieldValueConverter.convert(false, YES_NO, TEXT)).isEqualTo("No");
    }

    @Test
    void choiceConversions() {
        assertThat(FieldValueConverter.convert("Oslo", DROPDOWN, MULTI_SELECT)).isEqualTo(List.of("Oslo"));
        assertThat(FieldValueConverter.convert(List.of("A", "B"), MULTI_SELECT, DROPDOWN)).isEqualTo("A");
        assertThat(FieldValueConverter.convert(List.of(), MULTI_SELECT, DROPDOWN)).isNull();
        assertThat(FieldValueConverter.convert("A", TEXT, MULTI_SELECT)).isEqualTo(List.of("A"));
        assertThat(FieldValueConverter.convert("A", TEXT, DROPDOWN)).isEqualTo("A");
    }

    @Test
    void dateToTextKeepsIsoString() {
        assertThat(FieldValueConverter.convert("2026-03-10", DATE, TEXT)).isEqualTo("2026-03-10");
    }

    @Test
    void incompatibleConversionsYieldNull() {
        assertThat(FieldValueConverter.convert(List.of("a.jpg"), PHOTOS, TEXT)).isNull();
        assertThat(FieldValueConverter.convert(3.0, NUMBER, YES_NO)).isNull();
        assertThat(FieldValueConverter.convert(null, TEXT, NUMBER)).isNull();
    }
}
