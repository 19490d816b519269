package org.permafrost.archive.codec;

import org.permafrost.archive.session.ArchiveFormatException;
import org.permafrost.archive.session.IArchiveReader;
import org.permafrost.archive.session.IArchiveWriter;
import org.permafrost.archive.session.IDeepCodec;
import org.permafrost.runtime.model.Faction;

public final class FactionCodec implements IDeepCodec<Faction> {

    public static final FactionCodec INSTANCE = new FactionCodec();

    private FactionCodec() {
    }

    @Override
    public void write(Faction faction, IArchiveWriter out) {
        out.writeLong("id", faction.getId());
        out.writeString("name", faction.getName());
        out.writeBoolean("player", faction.isPlayer());
    }

    @Override
    public Faction read(IArchiveReader in) {
        long id = in.readLong("id", -1);
        if (id < 0) {
            throw new ArchiveFormatException("Faction record without id");
        }
        return new Faction(id, in.readString("name", "Faction " + id), in.readBoolean("player", false));
    }
}
