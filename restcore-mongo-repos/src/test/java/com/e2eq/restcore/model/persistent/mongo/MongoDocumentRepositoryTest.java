package com.e2eq.restcore.model.persistent.mongo;

import com.e2eq.restcore.model.BaseDocument;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.UpdateOptions;
import lombok.Data;
import lombok.EqualsAndHashCode;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class MongoDocumentRepositoryTest {

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class Account extends BaseDocument {
        private String login;
        private Integer visits;
    }

    @Mock
    private MongoConnection connection;
    @Mock
    private MongoDatabase database;
    @Mock
    private MongoCollection<Document> collection;

    private MongoDocumentRepository<Account> repository;

    @BeforeEach
    void setUp() {
        when(connection.getDatabase()).thenReturn(database);
        when(database.getCollection("accounts")).thenReturn(collection);
        repository = new MongoDocumentRepository<>(connection, "accounts", new DocumentMongoMapper<>(Account::new));
    }

    private static Account account(UUID id, String login) {
        Account account = new Account();
        account.setUuid(id);
        account.setLogin(login);
        account.setVisits(3);
        return account;
    }

    @SuppressWarnings("unchecked")
    private FindIterable<Document> stubFind() {
        FindIterable<Document> it = mock(FindIterable.class, RETURNS_SELF);
        when(collection.find(any(Bson.class))).thenReturn(it);
        return it;
    }

    @Test
    void testInsertStoresUuidAsId() {
        UUID id = UUID.randomUUID();
        repository.insert(account(id, "jdoe"), true);

        ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
        verify(collection).insertOne(captor.capture());
        Document stored = captor.getValue();
        assertEquals(id, stored.get("_id"));
        assertEquals("jdoe", stored.get("login"));
        assertFalse(stored.containsKey("uuid"));
    }

    @Test
    void testInsertWithoutEnforcedId() {
        repository.insert(account(UUID.randomUUID(), "jdoe"), false);

        ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
        verify(collection).insertOne(captor.capture());
        assertFalse(captor.getValue().containsKey("_id"));
        assertEquals(3, captor.getValue().get("visits"));
    }

    @Test
    void testFindByIdUnserializes() {
        UUID id = UUID.randomUUID();
        FindIterable<Document> it = stubFind();
        when(it.first()).thenReturn(new Document("_id", id).append("login", "jdoe").append("visits", 5));

        Account found = repository.findById(id);

        verify(collection).find(new Document("_id", id));
        assertEquals(id, found.getUuid());
        assertEquals("jdoe", found.getLogin());
        assertEquals(5, found.getVisits());
    }

    @Test
    void testFindByIdMissing() {
        FindIterable<Document> it = stubFind();
        when(it.first()).thenReturn(null);

        assertNull(repository.findById(UUID.randomUUID()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testStreamClosesCursor() {
        FindIterable<Document> it = stubFind();
        MongoCursor<Document> cursor = mock(MongoCursor.class);
        when(it.iterator()).thenReturn(cursor);
        when(cursor.hasNext()).thenReturn(true, true, false);
        when(cursor.next()).thenReturn(new Document("_id", 1), new Document("_id", 2));

        List<Document> rows = repository.stream(null, new Document("created", -1), 5, 10, null)
                .collect().asList()
                .await().indefinitely();

        assertEquals(List.of(new Document("_id", 1), new Document("_id", 2)), rows);
        verify(collection).find(new Document());
        verify(it).limit(5);
        verify(it).skip(10);
        verify(it).sort(new Document("created", -1));
        verify(cursor, times(1)).close();
    }

    @Test
    void testUpdateWrapsChangesInSet() {
        UUID id = UUID.randomUUID();
        repository.update(id, Map.of("login", "other"));

        verify(collection).updateOne(eq(new Document("_id", id)), eq(new Document("$set", new Document("login", "other"))));
    }

    @Test
    void testUpdateOrInsertAddsSetOnInsert() {
        Document filter = new Document("login", "jdoe");
        repository.updateOrInsert(filter, Map.of("visits", 1), Map.of("created", 100L));

        ArgumentCaptor<UpdateOptions> options = ArgumentCaptor.forClass(UpdateOptions.class);
        Document expected = new Document("$set", new Document("visits", 1))
                .append("$setOnInsert", new Document("created", 100L));
        verify(collection).updateOne(eq(filter), eq(expected), options.capture());
        assertTrue(options.getValue().isUpsert());
    }

    @Test
    void testFindOneAndUpdateReturnsUpdatedRecord() {
        UUID id = UUID.randomUUID();
        when(collection.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
                .thenReturn(new Document("_id", id).append("login", "after"));

        Account updated = repository.findByIdAndUpdate(id, Map.of("login", "after"), false);

        ArgumentCaptor<FindOneAndUpdateOptions> options = ArgumentCaptor.forClass(FindOneAndUpdateOptions.class);
        verify(collection).findOneAndUpdate(eq(new Document("_id", id)), eq(new Document("$set", new Document("login", "after"))), options.capture());
        assertEquals(ReturnDocument.AFTER, options.getValue().getReturnDocument());
        assertFalse(options.getValue().isUpsert());
        assertEquals("after", updated.getLogin());
    }

    @Test
    void testFindOneOrInsertUpserts() {
        Document filter = new Document("login", "jdoe");
        Document update = new Document("$setOnInsert", new Document("visits", 0));
        repository.findOneOrInsert(filter, update, true);

        ArgumentCaptor<FindOneAndUpdateOptions> options = ArgumentCaptor.forClass(FindOneAndUpdateOptions.class);
        verify(collection).findOneAndUpdate(eq(filter), eq(update), options.capture());
        assertTrue(options.getValue().isUpsert());
        assertEquals(ReturnDocument.BEFORE, options.getValue().getReturnDocument());
    }

    @Test
    void testDeleteKeysUsesIn() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        repository.deleteKeys(List.of(a, b));

        verify(collection).deleteMany(new Document("_id", new Document("$in", List.of(a, b))));
    }

    @Test
    void testCountWithoutFilter() {
        when(collection.countDocuments(any(Bson.class))).thenReturn(4L);

        assertEquals(4L, repository.count(null));
        assertEquals(4L, repository.countAsync(new Document("login", "jdoe")).await().indefinitely());
        verify(collection).countDocuments(new Document());
        verify(collection).countDocuments(new Document("login", "jdoe"));
    }

    @Test
    void testIdName() {
        assertEquals("_id", repository.getIdName());
        assertEquals("accounts", repository.getCollectionName());
    }
}
