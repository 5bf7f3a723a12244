package com.herzen.progress.structure;

import com.herzen.progress.domain.ProgressEngineException;
import com.herzen.progress.structure.StructureModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class StructureLoader {
    private static final Logger log = LoggerFactory.getLogger(StructureLoader.class);

    private final StructureSource source;
    private final StructureParser parser;
    private final StructureValidator validator;
    private final long revalidateMs;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CachedStructure> cache;

    public StructureLoader(StructureSource source,
                           StructureParser parser,
                           StructureValidator validator,
                           @Value("${progress.structure.cache-size:32}") int cacheSize,
                           @Value("${progress.structure.revalidate-ms:60000}") long revalidateMs) {
        this.source = source;
        this.parser = parser;
        this.validator = validator;
        this.revalidateMs = revalidateMs;
        int maxSize = cacheSize <= 0 ? 32 : cacheSize;
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CachedStructure> eldest) {
                return size() > maxSize;
            }
        };
    }

    public StructureTree load(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            throw ProgressEngineException.invalidRequest("subjectId is required");
        }
        long now = System.currentTimeMillis();
        CachedStructure cached = get(subjectId);
        if (cached != null) {
            if (now - cached.checkedAt() < revalidateMs) {
                return cached.tree();
            }
            Optional<String> version = source.currentVersion(subjectId);
            if (version.isPresent() && version.get().equals(cached.tree().version())) {
                put(subjectId, new CachedStructure(cached.tree(), now));
                return cached.tree();
            }
            log.info("Structure for subject {} changed upstream, reloading", subjectId);
        }

        SourceDocument document = source.fetch(subjectId).orElse(null);
        if (document == null) {
            invalidate(subjectId);
            throw ProgressEngineException.subjectNotFound(subjectId);
        }
        StructureTree tree = parse(document);
        put(subjectId, new CachedStructure(tree, now));
        return tree;
    }

    public void invalidate(String subjectId) {
        lock.lock();
        try {
            cache.remove(subjectId);
        } finally {
            lock.unlock();
        }
    }

    public int cachedCount() {
        lock.lock();
        try {
            return cache.size();
        } finally {
            lock.unlock();
        }
    }

    private StructureTree parse(SourceDocument document) {
        StructureParser.ParseResult result = parser.parse(document.subjectId(), document.version(), document.content());
        List<StructureIssue> issues = new ArrayList<>(result.issues());
        if (result.tree() != null) {
            issues.addAll(validator.validate(result.tree()));
        }

        Optional<StructureIssue> fatal = issues.stream().filter(StructureIssue::fatal).findFirst();
        if (fatal.isPresent() || result.tree() == null) {
            String detail = fatal.map(StructureIssue::message).orElse("no tree produced");
            throw ProgressEngineException.invalidStructure(document.subjectId(), detail);
        }
        issues.forEach(issue -> log.warn("Subject {} structure issue {} at {}: {}",
                document.subjectId(), issue.code(), issue.path(), issue.message()));

        StructureTree tree = result.tree();
        log.info("Loaded structure for subject {} version {} with {} lessons", tree.subjectId(), tree.version(), tree.lessonCount());
        return tree;
    }

    private CachedStructure get(String subjectId) {
        lock.lock();
        try {
            return cache.get(subjectId);
        } finally {
            lock.unlock();
        }
    }

    private void put(String subjectId, CachedStructure entry) {
        lock.lock();
        try {
            cache.put(subjectId, entry);
        } finally {
            lock.unlock();
        }
    }

    private record CachedStructure(StructureTree tree, long checkedAt) {}
}
