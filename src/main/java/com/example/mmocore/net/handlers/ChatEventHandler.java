package com.example.mmocore.net.handlers;

import com.example.mmocore.model.ChatChannel;
import com.example.mmocore.model.GameMap;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.EventType;
import com.example.mmocore.net.InboundEvent;
import com.example.mmocore.net.Messages;
import com.example.mmocore.net.OutboundMessage;
import com.example.mmocore.world.AreaOfInterest;

/**
 * Handles chat on the private, global, town and map channels.
 *
 * Checks run in order: length, channel, per-channel cooldown, channel rules.
 * A message only starts the channel's cooldown once it is delivered.
 */
public class ChatEventHandler implements EventHandler {

    @Override
    public boolean supports(String eventName) {
        return InboundEvent.SEND_CHAT.getWireName().equals(eventName);
    }

    @Override
    public boolean handle(EventContext ctx) {
        if (ctx.event != InboundEvent.SEND_CHAT) return false;
        Player sender = ctx.getPlayer();

        String raw = ctx.payload.getString("message");
        String message = raw == null ? "" : raw.trim();
        if (message.isEmpty()) return true;
        if (message.length() > ctx.services.config.getChatMaxLength()) {
            ctx.send(Messages.error(EventType.CHAT_ERROR, "Message is too long."));
            return true;
        }

        String type = ctx.payload.getString("type");
        ChatChannel channel = ChatChannel.fromKey(type);
        if (channel == null) {
            ctx.send(Messages.error(EventType.CHAT_ERROR, "Invalid chat type."));
            return true;
        }

        long now = ctx.now();
        if (!sender.isChatReady(channel, now, ctx.services.config.getChatCooldownMs())) {
            ctx.send(Messages.error(EventType.CHAT_SPAM_BLOCKED,
                    "You are sending " + channel.getKey() + " messages too quickly. Please wait a moment."));
            return true;
        }

        OutboundMessage chat = OutboundMessage.builder(EventType.CHAT_MESSAGE)
                .put("from", sender.getName())
                .put("message", message)
                .put("type", channel.getKey())
                .put("timestamp", now)
                .put("senderEmail", sender.getId())
                .build();
        AreaOfInterest aoi = ctx.services.aoi;

        switch (channel) {
            case PRIVATE: {
                Player target = ctx.services.world.getPlayer(ctx.payload.getString("targetEmail"));
                if (target == null || !target.isOnline()) return true;
                sender.markChat(channel, now);
                aoi.sendTo(target, chat);
                if (target != sender) aoi.sendTo(sender, chat);
                return true;
            }
            case GLOBAL:
                sender.markChat(channel, now);
                aoi.broadcastAll(chat);
                return true;
            case TOWN: {
                GameMap map = ctx.services.definition.getMap(sender.getMapId());
                if (map == null || !map.isSafeZone()) {
                    ctx.send(Messages.error(EventType.CHAT_ERROR, "You are not in a town map."));
                    return true;
                }
                sender.markChat(channel, now);
                aoi.broadcastToMap(sender.getMapId(), chat);
                return true;
            }
            case MAP:
                sender.markChat(channel, now);
                aoi.broadcastToMap(sender.getMapId(), chat);
                return true;
            default:
                return false;
        }
    }
}
