package org.logkeeper.ingest.api.events;

/**
 * Moderation and administrative action types recorded in the actions table.
 */
public enum ActionType {
    MESSAGE_DELETE,
    MESSAGE_EDIT,
    MESSAGE_BULK_DELETE,
    MEMBER_JOIN,
    MEMBER_LEAVE,
    MEMBER_BAN,
    MEMBER_UNBAN,
    MEMBER_KICK,
    MEMBER_TIMEOUT,
    MEMBER_UPDATE,
    ROLE_CREATE,
    ROLE_DELETE,
    ROLE_UPDATE,
    CHANNEL_CREATE,
    CHANNEL_DELETE,
    CHANNEL_UPDATE,
    GUILD_UPDATE,
    REACTION_ADD,
    REACTION_REMOVE,
    WEBHOOK_CREATE,
    WEBHOOK_UPDATE,
    WEBHOOK_DELETE,
    OTHER
}
