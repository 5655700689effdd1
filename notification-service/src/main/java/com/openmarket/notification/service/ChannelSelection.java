package com.openmarket.notification.service;

import com.openmarket.notification.domain.model.Channel;

public record ChannelSelection(boolean email, boolean sms) {

    /** Used when the user has no preference record. */
    public static final ChannelSelection DEFAULT = new ChannelSelection(true, false);

    public boolean isEnabled(Channel channel) {
        return channel == Channel.EMAIL ? email : sms;
    }
}
