package com.pipeline.refinery.normalize;

import com.pipeline.refinery.model.FieldSpec;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FieldAliasResolverTest {

    private final FieldAliasResolver resolver = new FieldAliasResolver();

    @Test
    void canonicalNameIsTriedBeforeAliases() {
        FieldSpec field = new FieldSpec("创建时间", Arrays.asList("time", "date"), true);

        assertEquals(Optional.of("创建时间"), resolver.resolve(Arrays.asList("date", "创建时间", "time"), field));
        assertEquals(Optional.of("time"), resolver.resolve(Arrays.asList("date", "time"), field));
    }

    @Test
    void matchingIgnoresCaseWhitespaceAndByteOrderMark() {
        FieldSpec field = new FieldSpec("Created_At", Collections.singletonList("Order Date"), true);

        assertEquals(Optional.of("\uFEFFcreated_at "), resolver.resolve(Arrays.asList("id", "\uFEFFcreated_at "), field));
        assertEquals(Optional.of("  ORDER DATE"), resolver.resolve(Arrays.asList("id", "  ORDER DATE"), field));
    }

    @Test
    void leadingSpaceInIdeographicHeaderIsIgnored() {
        FieldSpec field = new FieldSpec("订单时间", Collections.singletonList("创建时间"), true);

        assertEquals(Optional.of(" 创建时间"), resolver.resolve(Arrays.asList("id", " 创建时间"), field));
    }

    @Test
    void unresolvedFieldIsEmpty() {
        FieldSpec field = new FieldSpec("更新时间", Collections.singletonList("update_time"), true);

        assertTrue(resolver.resolve(Arrays.asList("id", "name"), field).isEmpty());
    }

    @Test
    void duplicateNormalizedHeadersKeepTheFirst() {
        FieldSpec field = new FieldSpec("date", Collections.emptyList(), false);
        List<String> columns = Arrays.asList("DATE", " date", "other");

        assertEquals(Optional.of("DATE"), resolver.resolve(columns, field));
        assertEquals(2, resolver.buildLookup(columns).size());
    }

    @Test
    void normalizeStripsMarkersAndLowersCase() {
        assertEquals("创建时间", FieldAliasResolver.normalize(" \uFEFF创建时间 "));
        assertEquals("abc", FieldAliasResolver.normalize("ABC"));
        assertEquals("", FieldAliasResolver.normalize(null));
    }
}
