package work.lcod.config.include;

import java.util.Optional;

/**
 * Maps the raw target of an include directive to a source, relative to the source that contains the directive.
 */
@FunctionalInterface
public interface IncludeLookup {
    Optional<SourceRef> locate(String target, SourceRef requester);
}
