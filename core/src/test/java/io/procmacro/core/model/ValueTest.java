package io.procmacro.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.procmacro.core.error.ExpressionTypeException;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Value canonical text")
class ValueTest {

    @Test
    void integersRenderInDecimal() {
        assertThat(Value.of(-42L).render()).isEqualTo("-42");
    }

    @Test
    void realsRenderWithoutExponent() {
        assertThat(Value.of(1.5).render()).isEqualTo("1.5");
        assertThat(Value.of(1e10).render()).isEqualTo("10000000000.0");
        assertThat(Value.of(2.0).render()).isEqualTo("2.0");
        assertThat(Value.of(0.0001).render()).isEqualTo("0.0001");
    }

    @Test
    void booleansAndText() {
        assertThat(Value.of(true).render()).isEqualTo("true");
        assertThat(Value.of("hello world").render()).isEqualTo("hello world");
        assertThat(new Value.Ident("CH1").render()).isEqualTo("CH1");
    }

    @Test
    void strAndIdentAreText() {
        assertThat(Value.of("x").isText()).isTrue();
        assertThat(new Value.Ident("x").isText()).isTrue();
        assertThat(Value.of(1L).isText()).isFalse();
        assertThat(Value.of(1L).isNumeric()).isTrue();
    }

    @Test
    void rowsHaveNoTextualForm() {
        Value row = new Value.RowRef("T", 0, new Row(Map.of("io", new Value.Ident("A"))));

        assertThat(row.typeName()).isEqualTo("Row");
        assertThatThrownBy(row::render).isInstanceOf(ExpressionTypeException.class);
    }
}
