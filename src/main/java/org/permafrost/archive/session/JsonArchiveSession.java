package org.permafrost.archive.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.permafrost.runtime.spi.IPostLoadInit;
import org.permafrost.runtime.spi.IReferenceable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link IPersistenceSession} over a Jackson tree model.
 * <p>
 * The document root carries a {@code format} version field; every other root field is
 * written by callers. Byte arrays are stored as Base64 text. References are stored as load ids.
 * </p>
 */
public final class JsonArchiveSession implements IPersistenceSession {

    private static final Logger LOG = LoggerFactory.getLogger(JsonArchiveSession.class);

    public static final String FORMAT_FIELD = "format";
    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper;
    private SessionMode mode = SessionMode.INACTIVE;
    private ObjectNode root;
    private CrossReferenceResolver resolver;
    private final List<IPostLoadInit> initTargets = new ArrayList<>();
    private final List<Runnable> postLoadActions = new ArrayList<>();
    private boolean cursorClosed;

    public JsonArchiveSession(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JsonArchiveSession() {
        this(new ObjectMapper());
    }

    @Override
    public SessionMode getMode() {
        return mode;
    }

    @Override
    public IArchiveWriter beginSave() {
        requireMode(SessionMode.INACTIVE, "begin save");
        root = mapper.createObjectNode();
        root.put(FORMAT_FIELD, FORMAT_VERSION);
        mode = SessionMode.SAVING;
        return new JsonArchiveWriter(root, this);
    }

    @Override
    public byte[] finalizeSaving() throws ArchiveException {
        requireMode(SessionMode.SAVING, "finalize saving");
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new ArchiveException("Failed to encode archive document", e);
        } finally {
            reset();
        }
    }

    @Override
    public IArchiveReader beginLoad(byte[] content) throws ArchiveException {
        requireMode(SessionMode.INACTIVE, "begin load");
        JsonNode tree;
        try {
            tree = mapper.readTree(content);
        } catch (IOException e) {
            throw new ArchiveException("Corrupt archive document: " + e.getMessage(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new ArchiveException("Archive document is not a JSON object");
        }
        JsonNode format = tree.get(FORMAT_FIELD);
        if (format == null || !format.isInt()) {
            throw new ArchiveException("Archive document has no format version");
        }
        if (format.intValue() > FORMAT_VERSION) {
            throw new ArchiveException("Unsupported archive format " + format.intValue()
                + " (supported up to " + FORMAT_VERSION + ")");
        }
        root = (ObjectNode) tree;
        resolver = new CrossReferenceResolver();
        cursorClosed = false;
        mode = SessionMode.LOADING_VARS;
        return new JsonArchiveReader(root, this);
    }

    @Override
    public void preRegister(IReferenceable target) {
        requireMode(SessionMode.LOADING_VARS, "pre-register targets");
        resolver.register(target, ReferenceOrigin.WORLD);
    }

    @Override
    public void closeReadCursor() {
        requireMode(SessionMode.LOADING_VARS, "close the read cursor");
        cursorClosed = true;
    }

    @Override
    public int resolveAllCrossReferences() {
        requireMode(SessionMode.LOADING_VARS, "resolve cross references");
        if (!cursorClosed) {
            throw new IllegalStateException("Read cursor must be closed before resolving cross references");
        }
        mode = SessionMode.RESOLVING_CROSS_REFS;
        return resolver.resolveAll();
    }

    @Override
    public int runPostLoadInit() {
        requireMode(SessionMode.RESOLVING_CROSS_REFS, "run post-load init");
        mode = SessionMode.POST_LOAD_INIT;
        int count = 0;
        for (IPostLoadInit target : initTargets) {
            target.postLoadInit();
            count++;
        }
        for (Runnable action : postLoadActions) {
            action.run();
            count++;
        }
        initTargets.clear();
        postLoadActions.clear();
        return count;
    }

    @Override
    public void reset() {
        if (mode != SessionMode.INACTIVE) {
            LOG.debug("Session reset from {}", mode);
        }
        mode = SessionMode.INACTIVE;
        root = null;
        resolver = null;
        cursorClosed = false;
        initTargets.clear();
        postLoadActions.clear();
    }

    /**
     * @return resolver of the running load session, or null outside of one
     */
    public CrossReferenceResolver getResolver() {
        return resolver;
    }

    ObjectMapper mapper() {
        return mapper;
    }

    void requireWritable() {
        requireMode(SessionMode.SAVING, "write fields");
    }

    void requireReadable() {
        requireMode(SessionMode.LOADING_VARS, "read fields");
        if (cursorClosed) {
            throw new IllegalStateException("Read cursor is closed");
        }
    }

    void registerDeep(Object loaded) {
        if (loaded instanceof IReferenceable) {
            resolver.register((IReferenceable) loaded, ReferenceOrigin.ARCHIVE);
        }
        if (loaded instanceof IPostLoadInit) {
            initTargets.add((IPostLoadInit) loaded);
        }
    }

    void queuePostLoadAction(Runnable action) {
        requireReadable();
        postLoadActions.add(action);
    }

    private void requireMode(SessionMode expected, String operation) {
        if (mode != expected) {
            throw new IllegalStateException("Cannot " + operation + " while session is " + mode);
        }
    }
}
