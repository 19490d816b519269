package org.permafrost.archive.codec;

import org.permafrost.archive.session.ArchiveFormatException;
import org.permafrost.archive.session.IArchiveReader;
import org.permafrost.archive.session.IArchiveWriter;
import org.permafrost.archive.session.IDeepCodec;
import org.permafrost.runtime.model.Creature;
import org.permafrost.runtime.model.GroupController;

/**
 * Deep codec for group controllers. Owned creatures are written as references so that the
 * ownership edge binds to the archived creature loaded in the same session.
 */
public final class GroupControllerCodec implements IDeepCodec<GroupController> {

    public static final GroupControllerCodec INSTANCE = new GroupControllerCodec();

    private GroupControllerCodec() {
    }

    @Override
    public void write(GroupController controller, IArchiveWriter out) {
        out.writeLong("id", controller.getId());
        out.writeString("label", controller.getLabel());
        out.writeReferenceList("owned", controller.getOwnedCreatures());
    }

    @Override
    public GroupController read(IArchiveReader in) {
        long id = in.readLong("id", -1);
        if (id < 0) {
            throw new ArchiveFormatException("Group controller record without id");
        }
        GroupController controller = new GroupController(id, in.readString("label", ""));
        // unresolved entries arrive as null and are dropped by postLoadInit
        in.readReferenceList("owned", Creature.class, owned -> controller.getOwnedCreatures().addAll(owned));
        return controller;
    }
}
