package org.permafrost.archive.codec;

import org.permafrost.archive.ArchiveRecord;
import org.permafrost.archive.session.IArchiveReader;
import org.permafrost.archive.session.IArchiveWriter;
import org.permafrost.archive.session.IDeepCodec;

/**
 * Writes the main region record. Grid layers are Base64 fields; absent layers are omitted.
 */
public final class ArchiveRecordCodec implements IDeepCodec<ArchiveRecord> {

    public static final ArchiveRecordCodec INSTANCE = new ArchiveRecordCodec();

    private ArchiveRecordCodec() {
    }

    @Override
    public void write(ArchiveRecord record, IArchiveWriter out) {
        out.writeLong("abandonedAtTick", record.getAbandonedAtTick());
        out.writeBytes("terrainGrid", record.getTerrain());
        out.writeBytes("roofGrid", record.getRoof());
        out.writeBytes("snowGrid", record.getSnow());
        out.writeBytes("pollutionGrid", record.getPollution());
        out.writeBytes("fogGrid", record.getFog());
        out.writeDeepList("entities", record.getEntities(), EntityCodec.INSTANCE);
        out.writeDeepList("groupLeaders", record.getGroupLeaders(), GroupControllerCodec.INSTANCE);
    }

    @Override
    public ArchiveRecord read(IArchiveReader in) {
        ArchiveRecord record = new ArchiveRecord();
        record.setAbandonedAtTick(in.readLong("abandonedAtTick", 0L));
        record.setTerrain(in.readBytes("terrainGrid"));
        record.setRoof(in.readBytes("roofGrid"));
        record.setSnow(in.readBytes("snowGrid"));
        record.setPollution(in.readBytes("pollutionGrid"));
        record.setFog(in.readBytes("fogGrid"));
        record.setEntities(in.readDeepList("entities", EntityCodec.INSTANCE));
        record.setGroupLeaders(in.readDeepList("groupLeaders", GroupControllerCodec.INSTANCE));
        return record;
    }
}
