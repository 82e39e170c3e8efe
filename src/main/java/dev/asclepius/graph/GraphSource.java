package dev.asclepius.graph;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Read access to the knowledge graph as needed by {@link GraphTraversal}. */
public interface GraphSource {

  /** Looks up entities by id. Unknown ids are absent from the returned map. */
  Map<String, ClinicalEntity> entities(Collection<String> entityIds);

  /** Returns every edge whose source or target is one of the given entities. */
  List<EntityRelationship> edgesTouching(Collection<String> entityIds);
}
