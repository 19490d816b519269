package org.permafrost.archive.codec;

import org.permafrost.archive.session.ArchiveFormatException;
import org.permafrost.archive.session.IArchiveReader;
import org.permafrost.archive.session.IArchiveWriter;
import org.permafrost.archive.session.IDeepCodec;
import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Container;
import org.permafrost.runtime.model.Corpse;
import org.permafrost.runtime.model.Creature;
import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.EntityCategory;
import org.permafrost.runtime.model.Faction;
import org.permafrost.runtime.model.Material;
import org.permafrost.runtime.model.Rotation;

import java.util.List;

/**
 * Deep codec for entities and their subtypes. The concrete type is stored in a {@code kind}
 * field. Container contents are written deep; the affiliation and a corpse's inner creature
 * are written as references.
 */
public final class EntityCodec implements IDeepCodec<Entity> {

    public static final EntityCodec INSTANCE = new EntityCodec();

    static final String KIND_ENTITY = "entity";
    static final String KIND_CREATURE = "creature";
    static final String KIND_CONTAINER = "container";
    static final String KIND_CORPSE = "corpse";

    private EntityCodec() {
    }

    @Override
    public void write(Entity entity, IArchiveWriter out) {
        out.writeString("kind", kindOf(entity));
        out.writeLong("id", entity.getId());
        out.writeString("def", entity.getDefName());
        out.writeString("category", entity.getCategory().name());
        out.writeString("material", entity.getMaterial().name());
        out.writeCell("pos", entity.getPosition());
        out.writeString("rot", entity.getRotation().name());
        out.writeInt("maxHp", entity.getMaxHitPoints());
        out.writeInt("hp", entity.getHitPoints());
        out.writeReference("faction", entity.getFaction());
        out.writeBoolean("naturalRock", entity.isNaturalRock());
        out.writeBoolean("blocks", entity.blocksMovement());
        out.writeBoolean("ingestible", entity.isIngestible());
        out.writeDouble("rotProgress", entity.getRotProgress());
        out.writeDouble("rotThreshold", entity.getRotThreshold());

        if (entity instanceof Creature) {
            Creature creature = (Creature) entity;
            out.writeBoolean("humanlike", creature.isHumanlike());
            out.writeBoolean("dead", creature.isDead());
            out.writeString("task", creature.getCurrentTask());
            out.writeString("duty", creature.getDuty());
        } else if (entity instanceof Container) {
            Container container = (Container) entity;
            out.writeInt("capacity", container.getCapacity());
            out.writeDeepList("contents", container.getContents(), this);
        } else if (entity instanceof Corpse) {
            out.writeReference("inner", ((Corpse) entity).getInnerCreature());
        }
    }

    @Override
    public Entity read(IArchiveReader in) {
        String kind = in.readString("kind", KIND_ENTITY);
        long id = in.readLong("id", -1);
        String def = in.readString("def", null);
        if (id < 0 || def == null) {
            throw new ArchiveFormatException("Entity record without id or def");
        }
        Entity entity;
        switch (kind) {
            case KIND_CREATURE: {
                Creature creature = new Creature(id, def, in.readBoolean("humanlike", false));
                creature.setDead(in.readBoolean("dead", false));
                creature.setCurrentTask(in.readString("task", null));
                creature.setDuty(in.readString("duty", null));
                entity = creature;
                break;
            }
            case KIND_CONTAINER: {
                Container container = new Container(id, def, in.readInt("capacity", 1));
                List<Entity> contents = in.readDeepList("contents", this);
                for (Entity held : contents) {
                    if (!container.tryAccept(held)) {
                        throw new ArchiveFormatException("Container " + def + "#" + id + " cannot hold " + held
                            + " (" + contents.size() + " entries, capacity " + container.getCapacity() + ")");
                    }
                }
                entity = container;
                break;
            }
            case KIND_CORPSE: {
                Corpse corpse = new Corpse(id, def);
                in.readReference("inner", Creature.class, corpse::setInnerCreature);
                entity = corpse;
                break;
            }
            case KIND_ENTITY:
                entity = new Entity(id, def, parseEnum(EntityCategory.class, in.readString("category", null), EntityCategory.ITEM));
                break;
            default:
                throw new ArchiveFormatException("Unknown entity kind '" + kind + "' for " + def + "#" + id);
        }
        entity.setMaterial(parseEnum(Material.class, in.readString("material", null), Material.OTHER));
        Cell pos = in.readCell("pos");
        entity.setPosition(pos != null ? pos : Cell.ORIGIN);
        entity.setRotation(parseEnum(Rotation.class, in.readString("rot", null), Rotation.NORTH));
        entity.setMaxHitPoints(in.readInt("maxHp", 0));
        entity.setHitPoints(in.readInt("hp", entity.getMaxHitPoints()));
        in.readReference("faction", Faction.class, entity::setFaction);
        entity.setNaturalRock(in.readBoolean("naturalRock", false));
        entity.setBlocksMovement(in.readBoolean("blocks", false));
        entity.setIngestible(in.readBoolean("ingestible", false));
        entity.setRotProgress(in.readDouble("rotProgress", 0.0));
        entity.setRotThreshold(in.readDouble("rotThreshold", 0.0));
        return entity;
    }

    private static String kindOf(Entity entity) {
        if (entity instanceof Creature) {
            return KIND_CREATURE;
        }
        if (entity instanceof Container) {
            return KIND_CONTAINER;
        }
        if (entity instanceof Corpse) {
            return KIND_CORPSE;
        }
        return KIND_ENTITY;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String name, E fallback) {
        if (name == null) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new ArchiveFormatException("Unknown " + type.getSimpleName() + " '" + name + "'", e);
        }
    }
}
