package me.golemcore.ngchat.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ViewerNumberSerializerTest {

    @Test
    void shouldWriteWholeNumbersWithoutFraction() {
        assertEquals("689", ViewerNumberSerializer.format(689.0));
        assertEquals("-1000", ViewerNumberSerializer.format(-1000.0));
        assertEquals("0", ViewerNumberSerializer.format(0.0));
        assertEquals("0", ViewerNumberSerializer.format(-0.0));
    }

    @Test
    void shouldWriteFractionsPlainInsideViewerRange() {
        assertEquals("1895.94", ViewerNumberSerializer.format(1895.94));
        assertEquals("-2094.8", ViewerNumberSerializer.format(-2094.8));
        assertEquals("0.000001", ViewerNumberSerializer.format(1e-6));
        assertEquals("0.25", ViewerNumberSerializer.format(0.25));
    }

    @Test
    void shouldUseLowerCaseExponentOutsidePlainRange() {
        assertEquals("1e-9", ViewerNumberSerializer.format(1e-9));
        assertEquals("8e-9", ViewerNumberSerializer.format(8e-9));
        assertEquals("2.5e-7", ViewerNumberSerializer.format(2.5e-7));
        assertEquals("1e+21", ViewerNumberSerializer.format(1e21));
        assertEquals("100000000000000000000", ViewerNumberSerializer.format(1e20));
    }

    @Test
    void shouldBeRegisteredOnSharedMapper() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("[1,1e-9,null]", mapper.writeValueAsString(Arrays.asList(1.0, 1e-9, Double.NaN)));
        assertEquals("[4.5]", mapper.writeValueAsString(List.of(4.5)));
    }
}
