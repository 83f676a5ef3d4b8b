package com.e2eq.restcore.model.persistent.commands;

import com.e2eq.restcore.model.persistent.mongo.DocumentRepository;
import com.e2eq.restcore.model.persistent.mongo.MongoUtils;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

public class ListBuilderTest {

    static class AccountListCommand extends AbstractListCommand<String> {
        private final DocumentRepository<String> repository;

        AccountListCommand(DocumentRepository<String> repository) {
            this.repository = repository;
        }

        @Override
        public DocumentRepository<String> getRepository() {
            return repository;
        }

        @Override
        public Map<String, FieldFilter> getAvailableFiltering() {
            Map<String, FieldFilter> filters = new LinkedHashMap<>();
            filters.put("active", FieldFilter.field("active").ofType(FilterFieldType.BOOL).withDefault(true));
            filters.put("age", FieldFilter.field("age").ofType(FilterFieldType.INT));
            filters.put("since", FieldFilter.field("created").ofType(FilterFieldType.DATE).withDefault(0L));
            filters.put("owner", FieldFilter.field("owner_id").ofType(FilterFieldType.UUID).programmaticOnly());
            filters.put("status", FieldFilter.mapped("state", v -> v.toString().toUpperCase()));
            filters.put("q", FieldFilter.search(v -> MongoUtils.matchString(v.toString()), "name", "email"));
            return filters;
        }

        @Override
        public Set<String> getAvailableSorting() {
            return Set.of("created", "name");
        }

        @Override
        public ListSort getDefaultSorting() {
            return new ListSort("created", SortDirection.DESC);
        }
    }

    private DocumentRepository<String> repository;
    private AccountListCommand command;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        repository = mock(DocumentRepository.class);
        when(repository.getIdName()).thenReturn("_id");
        when(repository.getCollectionName()).thenReturn("accounts");
        when(repository.unserialize(any())).thenAnswer(inv -> "account-" + ((Document) inv.getArgument(0)).get("_id"));
        command = new AccountListCommand(repository);
    }

    private void stubRows(int count) {
        Document[] rows = new Document[count];
        for (int i = 0; i < count; i++) {
            rows[i] = new Document("_id", i + 1).append("name", "n" + (i + 1));
        }
        when(repository.stream(any(), any(), anyInt(), anyInt(), any())).thenReturn(Multi.createFrom().items(rows));
    }

    // pagination

    @Test
    void testPaginationDefaults() {
        ListPagination p = command.newBuilder().withPagination(0, null).getPagination();
        assertEquals(new ListPagination(50, 0), p);
    }

    @Test
    void testPaginationClampsLimit() {
        ListPagination p = command.newBuilder().withPagination(3, 500).getPagination();
        assertEquals(new ListPagination(100, 200), p);
    }

    @Test
    void testPaginationFromText() {
        assertEquals(new ListPagination(10, 10), command.newBuilder().withPagination("2", "10").getPagination());
        assertEquals(new ListPagination(50, 0), command.newBuilder().withPagination("abc", "x").getPagination());
        assertEquals(new ListPagination(1, 0), command.newBuilder().withPagination("1", "-5").getPagination());
        assertEquals(new ListPagination(20, 40), command.newBuilder().withPagination(3, "", 20, 30).getPagination());
    }

    // sorting

    @Test
    void testPaginationCapsHugePageNumbers() {
        assertEquals(new ListPagination(100, Integer.MAX_VALUE),
                command.newBuilder().withPagination("9223372036854775807", "100").getPagination());
        assertEquals(new ListPagination(10, Integer.MAX_VALUE),
                command.newBuilder().withPagination(Long.MAX_VALUE, 10).getPagination());
    }

    @Test
    void testSortingFallsBackToDefault() {
        ListSort sort = command.newBuilder().withSorting("bogus", "up").getSorting();
        assertEquals(new ListSort("created", SortDirection.DESC), sort);
    }

    @Test
    void testSortingAccepted() {
        assertEquals(new ListSort("name", SortDirection.ASC), command.newBuilder().withSorting("name").getSorting());
        assertEquals(new ListSort("name", SortDirection.DESC), command.newBuilder().withSorting("name", "desc").getSorting());
        assertEquals(new ListSort("created", SortDirection.ASC), command.newBuilder().withSorting(null, "asc").getSorting());
        assertEquals(new Document("name", -1), new ListSort("name", SortDirection.DESC).toSortDocument());
    }

    // filtering

    @Test
    void testQueryIgnoresProgrammaticAndUnknownFields() {
        UUID owner = UUID.randomUUID();
        Document filter = command.newBuilder()
                .withQuery(Map.of("owner", List.of(owner.toString()), "password", List.of("x"), "age", List.of("4")))
                .getFiltering();

        assertEquals(new Document("age", 4L), filter);
    }

    @Test
    void testProgrammaticFilteringAcceptsAllDeclared() {
        UUID owner = UUID.randomUUID();
        Document filter = command.newBuilder()
                .withFiltering(Map.of("owner", owner.toString(), "unknown", 1))
                .getFiltering();

        assertEquals(new Document("owner_id", owner), filter);
    }

    @Test
    void testQueryTakesLastValue() {
        Map<String, List<String>> query = new LinkedHashMap<>();
        query.put("age", List.of("1", "7"));
        query.put("status", List.of());

        assertEquals(new Document("age", 7L), command.newBuilder().withQuery(query).getFiltering());
    }

    @Test
    void testCoercionFailureUsesDefault() {
        Document filter = command.newBuilder()
                .withQuery(Map.of("since", List.of("not a date"), "age", List.of("1.5")))
                .getFiltering();

        assertEquals(0L, filter.get("created"));
        assertTrue(filter.containsKey("age"));
        assertNull(filter.get("age"));
    }

    @Test
    void testTypedValues() {
        Document filter = command.newBuilder()
                .withQuery(Map.of("active", List.of("0"), "since", List.of("1970-01-02")))
                .getFiltering();

        assertEquals(Boolean.FALSE, filter.get("active"));
        assertEquals(86400L, filter.get("created"));
    }

    @Test
    void testMappedFilter() {
        assertEquals(new Document("state", "NEW"),
                command.newBuilder().withFiltering(Map.of("status", "new")).getFiltering());
    }

    @Test
    void testSearchBuildsOrAcrossFields() {
        Document filter = command.newBuilder().withQuery(Map.of("q", List.of("jo"))).getFiltering();

        Document regex = new Document("$regex", "^jo").append("$options", "i");
        assertEquals(List.of(new Document("name", regex), new Document("email", regex)), filter.get("$or"));
    }

    @Test
    void testEmptySearchEmitsNothing() {
        assertTrue(command.newBuilder().withQuery(Map.of("q", List.of(""))).getFiltering().isEmpty());
    }

    // execution

    @Test
    void testFetchDataUsesBuilderFacets() {
        stubRows(2);

        ListResult result = command.newBuilder()
                .withSorting("name", "asc")
                .withPagination(2, 2)
                .withProjection(Map.of("name", true))
                .fetchData()
                .await().indefinitely();

        assertEquals(List.of("account-1", "account-2"), result.getRows());
        verify(repository).stream(isNull(), eq(new Document("name", 1)), eq(2), eq(2), eq(new Document("name", true)));
    }

    @Test
    void testFetchAsMapWithRows() {
        stubRows(2);

        ListResult result = command.newBuilder()
                .withSerialization(row -> ((Document) row).get("name"), true, true)
                .fetchData()
                .await().indefinitely();

        assertTrue(result.isMap());
        assertEquals(Map.of(1, "n1", 2, "n2"), result.getRowsById());
        verify(repository, never()).unserialize(any());
    }

    @Test
    void testSerializerReceivesEntity() {
        stubRows(1);

        ListResult result = command.newBuilder()
                .withSerialization(entity -> entity.toString().toUpperCase())
                .fetchData()
                .await().indefinitely();

        assertEquals(List.of("ACCOUNT-1"), result.getRows());
    }

    @Test
    void testRawRows() {
        stubRows(1);

        ListResult result = command.newBuilder()
                .withSerialization(null, true, false)
                .fetchData()
                .await().indefinitely();

        assertEquals(List.of(new Document("_id", 1).append("name", "n1")), result.getRows());
    }

    @Test
    void testSerializerMayReturnNull() {
        stubRows(2);

        ListResult result = command.newBuilder()
                .withSerialization(row -> null, true, false)
                .fetchData()
                .await().indefinitely();

        assertEquals(Arrays.asList(null, null), result.getRows());
    }

    // counting

    @Test
    void testFullPageIsCounted() {
        stubRows(10);
        when(repository.countAsync(any())).thenReturn(Uni.createFrom().item(42L));

        CountedListResult result = command.newBuilder().withPagination(1, 10).fetchWithCount().await().indefinitely();

        assertEquals(10, result.getResult().size());
        assertEquals(42L, result.getTotalCount());
        verify(repository).countAsync(isNull());
    }

    @Test
    void testShortFirstPageIsNotCounted() {
        stubRows(3);

        CountedListResult result = command.newBuilder().withPagination(1, 10).fetchWithCount().await().indefinitely();

        assertEquals(3L, result.getTotalCount());
        verify(repository, never()).countAsync(any());
    }

    @Test
    void testEmptyPagePastStartIsCounted() {
        stubRows(0);
        when(repository.countAsync(any())).thenReturn(Uni.createFrom().item(7L));

        CountedListResult result = command.newBuilder().withPagination(5, 10).fetchWithCount().await().indefinitely();

        assertEquals(7L, result.getTotalCount());
    }

    @Test
    void testEmptyFirstPage() {
        stubRows(0);

        CountedListResult result = command.newBuilder().withPagination(1, 10).fetchWithCount().await().indefinitely();

        assertEquals(0L, result.getTotalCount());
        verify(repository, never()).countAsync(any());
    }

    @Test
    void testCountUsesPostProcessedFilter() {
        AccountListCommand scoped = new AccountListCommand(repository) {
            @Override
            protected Document postProcessFiltering(Document filtering) {
                return new Document(filtering).append("deleted", false);
            }
        };
        stubRows(10);
        when(repository.countAsync(any())).thenReturn(Uni.createFrom().item(11L));

        scoped.newBuilder()
                .withFiltering(Map.of("age", 30))
                .withPagination(1, 10)
                .fetchWithCount()
                .await().indefinitely();

        Bson expected = new Document("age", 30L).append("deleted", false);
        verify(repository).stream(eq(expected), isNull(), eq(10), eq(0), isNull());
        verify(repository).countAsync(expected);
    }
}
