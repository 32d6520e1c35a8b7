package hlsyde.common.binding;

import hlsyde.common.ProcessCollection;

import java.util.Map;

/**
 * Collections bound together, keyed by resource name: {@code {type}{i}} for
 * processing elements and {@code memory{i}} for memories. The direct
 * interconnects are the zero-length transfers that need no storage.
 */
public record BindingResult(
        Map<String, ProcessCollection> processingElements,
        Map<String, ProcessCollection> memories,
        ProcessCollection directInterconnects) {
}
