package com.protogen.generator.resolver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protogen.generator.model.ExtendDescriptor;
import com.protogen.generator.model.MessageDescriptor;
import com.protogen.generator.model.ProtoDescriptor;
import com.protogen.generator.model.QualifiedNames;

/**
 * Splices the fields of {@code extend} blocks into the messages they extend.
 *
 * Targets are looked up along the declaring scope's chain among the loaded messages.
 * A block whose target is not loaded is left in place and skipped; it is not an error.
 * Merged blocks are removed from their file, so running the merger again is a no-op for them.
 */
public class ExtensionMerger {
    private static final Logger log = LoggerFactory.getLogger(ExtensionMerger.class);

    /**
     * @return the extend blocks that were skipped because their target is not loaded
     */
    public List<ExtendDescriptor> merge(List<ProtoDescriptor> protos) {
        Map<String, MessageDescriptor> messagesByName = new HashMap<>();
        for (ProtoDescriptor proto : protos) {
            collectMessages(proto.getMessages(), messagesByName);
        }

        int merged = 0;
        List<ExtendDescriptor> skipped = new ArrayList<>();
        for (ProtoDescriptor proto : protos) {
            for (ExtendDescriptor extend : new ArrayList<>(proto.getExtends())) {
                MessageDescriptor target = findTarget(extend, messagesByName);
                if (target == null) {
                    log.debug("No loaded target for extend {} in {}; skipping", extend.getTargetName(), proto.getName());
                    skipped.add(extend);
                    continue;
                }
                extend.mergeInto(target);
                proto.removeExtend(extend);
                merged++;
                log.debug("Merged {} fields from {} into {}", extend.getFields().size(), proto.getName(), target.getFullName());
            }
        }

        if (merged > 0) {
            log.info("Merged {} extend blocks", merged);
        }
        return skipped;
    }

    private MessageDescriptor findTarget(ExtendDescriptor extend, Map<String, MessageDescriptor> messagesByName) {
        String targetName = extend.getTargetName();
        if (QualifiedNames.isFullyQualified(targetName)) {
            return messagesByName.get(targetName.substring(1));
        }
        for (String scope : QualifiedNames.scopeChain(extend.getScope())) {
            MessageDescriptor target = messagesByName.get(QualifiedNames.join(scope, targetName));
            if (target != null) {
                return target;
            }
        }
        return null;
    }

    private void collectMessages(List<MessageDescriptor> messages, Map<String, MessageDescriptor> messagesByName) {
        for (MessageDescriptor message : messages) {
            messagesByName.put(message.getFullName(), message);
            collectMessages(message.getMessages(), messagesByName);
        }
    }
}
