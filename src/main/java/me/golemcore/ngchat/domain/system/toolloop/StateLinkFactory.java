package me.golemcore.ngchat.domain.system.toolloop;

import me.golemcore.ngchat.domain.exception.SerializationException;
import me.golemcore.ngchat.domain.model.StateLink;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.service.ViewerLinkMasker;
import me.golemcore.ngchat.domain.service.ViewerStateCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes a session's current state into a shareable link and its masked
 * markdown form, and masks raw links in final answers.
 */
public class StateLinkFactory {

    private static final Logger log = LoggerFactory.getLogger(StateLinkFactory.class);

    private final ViewerStateCodec codec;
    private final ViewerLinkMasker masker;

    public StateLinkFactory(ViewerStateCodec codec, ViewerLinkMasker masker) {
        this.codec = codec;
        this.masker = masker;
    }

    /**
     * @return the link, or {@code null} when the state cannot be encoded
     */
    public StateLink create(ViewerSession session) {
        try {
            String url = codec.encode(session.getState());
            return new StateLink(url, masker.maskedLink(url));
        } catch (SerializationException e) {
            log.warn("[ToolLoop] Failed to encode state link for session {}: {}", session.getId(), e.getMessage());
            return null;
        }
    }

    public String mask(String text) {
        return masker.mask(text);
    }
}
