package org.permafrost.archive.session;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.spi.IReferenceable;

import java.util.Collection;
import java.util.List;

final class JsonArchiveWriter implements IArchiveWriter {

    private final ObjectNode node;
    private final JsonArchiveSession session;

    JsonArchiveWriter(ObjectNode node, JsonArchiveSession session) {
        this.node = node;
        this.session = session;
    }

    @Override
    public void writeInt(String name, int value) {
        session.requireWritable();
        node.put(name, value);
    }

    @Override
    public void writeLong(String name, long value) {
        session.requireWritable();
        node.put(name, value);
    }

    @Override
    public void writeDouble(String name, double value) {
        session.requireWritable();
        node.put(name, value);
    }

    @Override
    public void writeBoolean(String name, boolean value) {
        session.requireWritable();
        node.put(name, value);
    }

    @Override
    public void writeString(String name, String value) {
        session.requireWritable();
        if (value != null) {
            node.put(name, value);
        }
    }

    @Override
    public void writeBytes(String name, byte[] value) {
        session.requireWritable();
        if (value != null) {
            node.put(name, value);
        }
    }

    @Override
    public void writeCell(String name, Cell cell) {
        session.requireWritable();
        if (cell != null) {
            ObjectNode c = node.putObject(name);
            c.put("x", cell.x());
            c.put("z", cell.z());
        }
    }

    @Override
    public void writeReference(String name, IReferenceable target) {
        session.requireWritable();
        if (target != null) {
            node.put(name, target.getUniqueLoadId());
        }
    }

    @Override
    public void writeReferenceList(String name, Collection<? extends IReferenceable> targets) {
        session.requireWritable();
        if (targets == null) {
            return;
        }
        ArrayNode array = node.putArray(name);
        for (IReferenceable target : targets) {
            if (target == null) {
                array.addNull();
            } else {
                array.add(target.getUniqueLoadId());
            }
        }
    }

    @Override
    public <T> void writeDeep(String name, T value, IDeepCodec<T> codec) {
        session.requireWritable();
        if (value != null) {
            codec.write(value, new JsonArchiveWriter(node.putObject(name), session));
        }
    }

    @Override
    public <T> void writeDeepList(String name, List<T> values, IDeepCodec<T> codec) {
        session.requireWritable();
        if (values == null) {
            return;
        }
        ArrayNode array = node.putArray(name);
        for (T value : values) {
            codec.write(value, new JsonArchiveWriter(array.addObject(), session));
        }
    }

    @Override
    public IArchiveWriter child(String name) {
        session.requireWritable();
        return new JsonArchiveWriter(node.putObject(name), session);
    }
}
