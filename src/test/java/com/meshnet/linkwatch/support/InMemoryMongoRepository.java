package com.meshnet.linkwatch.support;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Example;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.repository.query.FluentQuery;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Map backed stand-in for a Spring Data Mongo repository. Documents are kept
 * in insertion order and stored through {@code copier}, so with a copying
 * {@code copier} changes only become visible once saved, as with a database.
 * Query by example and paging are not supported.
 */
public abstract class InMemoryMongoRepository<T> implements MongoRepository<T, String> {

    protected final Map<String, T> documents = new LinkedHashMap<>();

    private final Function<T, String> idOf;
    private final BiConsumer<T, String> idSetter;
    private final UnaryOperator<T> copier;

    protected InMemoryMongoRepository(Function<T, String> idOf, BiConsumer<T, String> idSetter,
                                      UnaryOperator<T> copier) {
        this.idOf = idOf;
        this.idSetter = idSetter;
        this.copier = copier;
    }

    /**
     * Unique index checks, run with the store locked before a document is
     * written. Implementations throw {@link DuplicateKeyException}.
     */
    protected void checkUniqueIndexes(T document) {
    }

    protected synchronized Optional<T> findFirst(Predicate<? super T> filter) {
        return documents.values().stream().filter(filter).findFirst().map(copier);
    }

    protected synchronized List<T> findWhere(Predicate<? super T> filter) {
        return documents.values().stream().filter(filter).map(copier).toList();
    }

    protected synchronized long countWhere(Predicate<? super T> filter) {
        return documents.values().stream().filter(filter).count();
    }

    @Override
    public synchronized <S extends T> S insert(S document) {
        String id = idOf.apply(document);
        if (id != null && documents.containsKey(id)) {
            throw new DuplicateKeyException("E11000 duplicate key error index: _id_ dup key: " + id);
        }
        return write(document);
    }

    @Override
    public synchronized <S extends T> List<S> insert(Iterable<S> documents) {
        List<S> inserted = new ArrayList<>();
        for (S document : documents) {
            inserted.add(insert(document));
        }
        return inserted;
    }

    @Override
    public synchronized <S extends T> S save(S document) {
        return write(document);
    }

    @Override
    public synchronized <S extends T> List<S> saveAll(Iterable<S> documents) {
        List<S> saved = new ArrayList<>();
        for (S document : documents) {
            saved.add(save(document));
        }
        return saved;
    }

    private <S extends T> S write(S document) {
        checkUniqueIndexes(document);
        if (idOf.apply(document) == null) {
            idSetter.accept(document, UUID.randomUUID().toString());
        }
        documents.put(idOf.apply(document), copier.apply(document));
        return document;
    }

    @Override
    public synchronized Optional<T> findById(String id) {
        return Optional.ofNullable(documents.get(id)).map(copier);
    }

    @Override
    public synchronized boolean existsById(String id) {
        return documents.containsKey(id);
    }

    @Override
    public synchronized List<T> findAll() {
        return findWhere(document -> true);
    }

    @Override
    public synchronized List<T> findAllById(Iterable<String> ids) {
        List<T> found = new ArrayList<>();
        for (String id : ids) {
            findById(id).ifPresent(found::add);
        }
        return found;
    }

    @Override
    public synchronized long count() {
        return documents.size();
    }

    @Override
    public synchronized void deleteById(String id) {
        documents.remove(id);
    }

    @Override
    public synchronized void delete(T document) {
        documents.remove(idOf.apply(document));
    }

    @Override
    public synchronized void deleteAllById(Iterable<? extends String> ids) {
        for (String id : ids) {
            documents.remove(id);
        }
    }

    @Override
    public synchronized void deleteAll(Iterable<? extends T> documents) {
        for (T document : documents) {
            delete(document);
        }
    }

    @Override
    public synchronized void deleteAll() {
        documents.clear();
    }

    @Override
    public List<T> findAll(Sort sort) {
        throw new UnsupportedOperationException("sorting");
    }

    @Override
    public Page<T> findAll(Pageable pageable) {
        throw new UnsupportedOperationException("paging");
    }

    @Override
    public <S extends T> Optional<S> findOne(Example<S> example) {
        throw new UnsupportedOperationException("query by example");
    }

    @Override
    public <S extends T> List<S> findAll(Example<S> example) {
        throw new UnsupportedOperationException("query by example");
    }

    @Override
    public <S extends T> List<S> findAll(Example<S> example, Sort sort) {
        throw new UnsupportedOperationException("query by example");
    }

    @Override
    public <S extends T> Page<S> findAll(Example<S> example, Pageable pageable) {
        throw new UnsupportedOperationException("query by example");
    }

    @Override
    public <S extends T> long count(Example<S> example) {
        throw new UnsupportedOperationException("query by example");
    }

    @Override
    public <S extends T> boolean exists(Example<S> example) {
        throw new UnsupportedOperationException("query by example");
    }

    @Override
    public <S extends T, R> R findBy(Example<S> example,
                                     Function<FluentQuery.FetchableFluentQuery<S>, R> queryFunction) {
        throw new UnsupportedOperationException("query by example");
    }
}
