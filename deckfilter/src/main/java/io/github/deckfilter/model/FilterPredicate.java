package io.github.deckfilter.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Include/exclude constraints selecting a deck subset.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableFilterPredicate.class)
@JsonDeserialize(as = ImmutableFilterPredicate.class)
public interface FilterPredicate {

  /**
   * Include filters, all of which must hold.
   *
   * @return the include
   */
  List<IncludeFilter> include();

  /**
   * Exclude filters, none of whose cards may appear.
   *
   * @return the exclude
   */
  List<ExcludeFilter> exclude();
}
