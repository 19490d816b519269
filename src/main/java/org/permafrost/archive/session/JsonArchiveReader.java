package org.permafrost.archive.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.spi.IReferenceable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

final class JsonArchiveReader implements IArchiveReader {

    private final ObjectNode node;
    private final JsonArchiveSession session;

    JsonArchiveReader(ObjectNode node, JsonArchiveSession session) {
        this.node = node;
        this.session = session;
    }

    @Override
    public boolean has(String name) {
        session.requireReadable();
        JsonNode value = node.get(name);
        return value != null && !value.isNull();
    }

    @Override
    public int readInt(String name, int defaultValue) {
        JsonNode value = field(name);
        if (value == null) {
            return defaultValue;
        }
        requireShape(value.canConvertToInt(), name, "int");
        return value.intValue();
    }

    @Override
    public long readLong(String name, long defaultValue) {
        JsonNode value = field(name);
        if (value == null) {
            return defaultValue;
        }
        requireShape(value.canConvertToLong(), name, "long");
        return value.longValue();
    }

    @Override
    public double readDouble(String name, double defaultValue) {
        JsonNode value = field(name);
        if (value == null) {
            return defaultValue;
        }
        requireShape(value.isNumber(), name, "number");
        return value.doubleValue();
    }

    @Override
    public boolean readBoolean(String name, boolean defaultValue) {
        JsonNode value = field(name);
        if (value == null) {
            return defaultValue;
        }
        requireShape(value.isBoolean(), name, "boolean");
        return value.booleanValue();
    }

    @Override
    public String readString(String name, String defaultValue) {
        JsonNode value = field(name);
        if (value == null) {
            return defaultValue;
        }
        requireShape(value.isTextual(), name, "string");
        return value.textValue();
    }

    @Override
    public byte[] readBytes(String name) {
        JsonNode value = field(name);
        if (value == null) {
            return null;
        }
        requireShape(value.isTextual() || value.isBinary(), name, "base64 string");
        try {
            return value.binaryValue();
        } catch (IOException | IllegalArgumentException e) {
            throw new ArchiveFormatException("Field '" + name + "' is not valid base64", e);
        }
    }

    @Override
    public Cell readCell(String name) {
        JsonNode value = field(name);
        if (value == null) {
            return null;
        }
        requireShape(value.isObject() && value.has("x") && value.has("z"), name, "cell");
        return new Cell(value.get("x").asInt(), value.get("z").asInt());
    }

    @Override
    public <T extends IReferenceable> void readReference(String name, Class<T> type, Consumer<T> setter) {
        JsonNode value = field(name);
        if (value == null) {
            return;
        }
        requireShape(value.isTextual(), name, "reference");
        session.getResolver().request(value.textValue(), type, setter);
    }

    @Override
    public <T extends IReferenceable> void readReferenceList(String name, Class<T> type, Consumer<List<T>> setter) {
        JsonNode value = field(name);
        if (value == null) {
            return;
        }
        requireShape(value.isArray(), name, "reference list");
        List<String> ids = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            ids.add(element.isNull() ? null : element.asText());
        }
        session.getResolver().requestList(ids, type, setter);
    }

    @Override
    public <T> T readDeep(String name, IDeepCodec<T> codec) {
        JsonNode value = field(name);
        if (value == null) {
            return null;
        }
        requireShape(value.isObject(), name, "object");
        return readObject((ObjectNode) value, codec);
    }

    @Override
    public <T> List<T> readDeepList(String name, IDeepCodec<T> codec) {
        JsonNode value = field(name);
        if (value == null) {
            return Collections.emptyList();
        }
        requireShape(value.isArray(), name, "object list");
        List<T> result = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            if (!element.isObject()) {
                throw new ArchiveFormatException("Element of '" + name + "' is not an object");
            }
            result.add(readObject((ObjectNode) element, codec));
        }
        return result;
    }

    @Override
    public Optional<IArchiveReader> child(String name) {
        JsonNode value = field(name);
        if (value == null) {
            return Optional.empty();
        }
        requireShape(value.isObject(), name, "object");
        return Optional.of(new JsonArchiveReader((ObjectNode) value, session));
    }

    @Override
    public void onPostLoadInit(Runnable action) {
        session.queuePostLoadAction(action);
    }

    private <T> T readObject(ObjectNode objectNode, IDeepCodec<T> codec) {
        T loaded = codec.read(new JsonArchiveReader(objectNode, session));
        if (loaded != null) {
            session.registerDeep(loaded);
        }
        return loaded;
    }

    private JsonNode field(String name) {
        session.requireReadable();
        JsonNode value = node.get(name);
        return value == null || value.isNull() ? null : value;
    }

    private static void requireShape(boolean ok, String name, String expected) {
        if (!ok) {
            throw new ArchiveFormatException("Field '" + name + "' is not a " + expected);
        }
    }
}
