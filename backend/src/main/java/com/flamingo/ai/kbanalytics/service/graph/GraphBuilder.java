package com.flamingo.ai.kbanalytics.service.graph;

import com.flamingo.ai.kbanalytics.domain.enums.ExpertiseLevel;
import com.flamingo.ai.kbanalytics.domain.enums.NodeType;
import com.flamingo.ai.kbanalytics.service.corpus.DocumentProfile;
import com.flamingo.ai.kbanalytics.service.expertise.ExpertiseEntry;
import com.flamingo.ai.kbanalytics.service.expertise.MemberExpertise;
import com.flamingo.ai.kbanalytics.service.expertise.TeamExpertiseMap;
import com.flamingo.ai.kbanalytics.service.keyword.LabelNormalizer;
import com.flamingo.ai.kbanalytics.service.similarity.EmbeddedDocument;
import com.flamingo.ai.kbanalytics.service.similarity.SimilarityIndex;
import com.flamingo.ai.kbanalytics.service.similarity.SimilarityMatch;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the knowledge graph from a bounded document set.
 *
 * <p>Nodes live in an id-keyed index and edges refer to nodes only by id, so the graph is assembled
 * without recursion and every edge endpoint can be checked against the index before returning.
 *
 * <p>Similarity edges are chosen in three steps: each embedded document proposes its top {@code
 * maxEdges} neighbours at or above the threshold; proposals are merged per unordered pair; pairs
 * are then accepted strongest first while both endpoints still have spare degree. No document ends
 * up with more than {@code maxEdges} similarity edges even when it appears in many other
 * documents' top lists.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphBuilder {

  private static final double MEMBERSHIP_WEIGHT = 1.0;

  private final SimilarityIndex similarityIndex;

  /**
   * Builds a graph over {@code documents} in the given order.
   *
   * @param documents documents to include, at most {@code query.maxDocuments()} are used
   * @param expertise team expertise for person nodes, or null to skip them
   */
  public KnowledgeGraph build(
      List<DocumentProfile> documents, KnowledgeGraphQuery query, TeamExpertiseMap expertise) {
    List<DocumentProfile> included =
        documents.size() > query.maxDocuments()
            ? documents.subList(0, query.maxDocuments())
            : documents;

    GraphAssembly graph = new GraphAssembly();
    for (DocumentProfile document : included) {
      graph.addNode(
          GraphNode.document(
              document.documentId(),
              document.displayTitle(),
              document.summary(),
              document.topics()));
    }

    addSimilarityEdges(included, query, graph);

    if (query.includeTopics()) {
      addDerivedNodes(included, NodeType.TOPIC, DocumentProfile::topics, graph);
    }
    if (query.includeTechnologies()) {
      addDerivedNodes(included, NodeType.TECHNOLOGY, DocumentProfile::technologies, graph);
    }
    if (query.includeInsights()) {
      addDerivedNodes(included, NodeType.INSIGHT, DocumentProfile::insights, graph);
    }
    if (query.includePeople() && expertise != null) {
      addPersonNodes(expertise, graph);
    }

    KnowledgeGraph result = graph.toGraph(included.size(), query);
    log.debug(
        "Built knowledge graph: {} documents, {} nodes, {} edges",
        included.size(),
        result.nodes().size(),
        result.edges().size());
    return result;
  }

  private void addSimilarityEdges(
      List<DocumentProfile> documents, KnowledgeGraphQuery query, GraphAssembly graph) {
    List<EmbeddedDocument> corpus =
        documents.stream()
            .filter(DocumentProfile::hasEmbedding)
            .map(DocumentProfile::toEmbedded)
            .toList();
    Map<UUID, Integer> position = new HashMap<>();
    for (int i = 0; i < documents.size(); i++) {
      position.put(documents.get(i).documentId(), i);
    }

    // Unordered pair -> candidate; the endpoint earlier in document order is the source
    Map<String, Candidate> candidates = new HashMap<>();
    for (EmbeddedDocument document : corpus) {
      List<SimilarityMatch> matches =
          similarityIndex.topSimilar(
              document.vector(), corpus, query.maxEdges() + 1, query.threshold());
      int taken = 0;
      for (SimilarityMatch match : matches) {
        if (match.documentId().equals(document.documentId())) {
          continue;
        }
        if (taken++ == query.maxEdges()) {
          break;
        }
        UUID first = document.documentId();
        UUID second = match.documentId();
        if (position.get(second) < position.get(first)) {
          first = match.documentId();
          second = document.documentId();
        }
        String source = NodeType.DOCUMENT.nodeId(first.toString());
        String target = NodeType.DOCUMENT.nodeId(second.toString());
        candidates.putIfAbsent(
            source + "|" + target, new Candidate(source, target, match.similarity()));
      }
    }

    List<Map.Entry<String, Candidate>> ranked = new ArrayList<>(candidates.entrySet());
    ranked.sort(
        Comparator.comparingDouble((Map.Entry<String, Candidate> e) -> e.getValue().weight())
            .reversed()
            .thenComparing(Map.Entry::getKey));

    Map<String, Integer> degree = new HashMap<>();
    for (Map.Entry<String, Candidate> entry : ranked) {
      Candidate candidate = entry.getValue();
      if (degree.getOrDefault(candidate.source(), 0) >= query.maxEdges()
          || degree.getOrDefault(candidate.target(), 0) >= query.maxEdges()) {
        continue;
      }
      degree.merge(candidate.source(), 1, Integer::sum);
      degree.merge(candidate.target(), 1, Integer::sum);
      graph.addSimilarityEdge(candidate.source(), candidate.target(), candidate.weight());
    }
  }

  /**
   * Adds one node per distinct normalized label and a membership edge from every referencing
   * document. Labels that normalize to nothing are skipped.
   */
  private void addDerivedNodes(
      List<DocumentProfile> documents,
      NodeType type,
      Function<DocumentProfile, List<String>> labels,
      GraphAssembly graph) {
    Map<String, String> spelling = new LinkedHashMap<>();
    Map<String, Integer> documentCounts = new HashMap<>();

    for (DocumentProfile document : documents) {
      Set<String> seen = new HashSet<>();
      for (String label : labels.apply(document)) {
        String key = LabelNormalizer.normalize(label);
        if (key.isEmpty() || !seen.add(key)) {
          continue;
        }
        spelling.putIfAbsent(key, label.trim());
        documentCounts.merge(key, 1, Integer::sum);
        graph.addMembershipEdge(
            NodeType.DOCUMENT.nodeId(document.documentId().toString()),
            type.nodeId(key),
            MEMBERSHIP_WEIGHT);
      }
    }

    spelling.forEach(
        (key, label) ->
            graph.addNode(GraphNode.derived(type, key, label, documentCounts.get(key))));
  }

  /**
   * Adds a person node per team member, linked to the topic and technology nodes already in the
   * graph where the member is at least intermediate. Edge weight is the member's document count on
   * the area divided by the largest such count in the team.
   */
  private void addPersonNodes(TeamExpertiseMap expertise, GraphAssembly graph) {
    long maxCount =
        expertise.entries().stream().mapToLong(ExpertiseEntry::documentCount).max().orElse(1);

    for (MemberExpertise member : expertise.members()) {
      String userKey = member.userId().toString();
      String personId = NodeType.PERSON.nodeId(userKey);
      String label = member.username() != null ? member.username() : userKey;
      graph.addNode(GraphNode.derived(NodeType.PERSON, userKey, label, member.totalDocuments()));

      for (ExpertiseEntry entry : member.expertiseAreas()) {
        if (!entry.level().isAtLeast(ExpertiseLevel.INTERMEDIATE)) {
          continue;
        }
        String key = LabelNormalizer.normalize(entry.topic());
        double weight = (double) entry.documentCount() / Math.max(maxCount, 1);
        for (NodeType areaType : List.of(NodeType.TOPIC, NodeType.TECHNOLOGY)) {
          String areaId = areaType.nodeId(key);
          if (graph.hasNode(areaId)) {
            graph.addMembershipEdge(personId, areaId, weight);
          }
        }
      }
    }
  }

  private record Candidate(String source, String target, double weight) {}

  /** Id-keyed node index plus the edge list that refers into it. */
  private static final class GraphAssembly {
    private final Map<String, GraphNode> nodeIndex = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private final Set<String> linkedPairs = new HashSet<>();
    private int similarityEdgeCount;
    private int membershipEdgeCount;

    void addNode(GraphNode node) {
      nodeIndex.put(node.id(), node);
    }

    boolean hasNode(String nodeId) {
      return nodeIndex.containsKey(nodeId);
    }

    void addSimilarityEdge(String source, String target, double weight) {
      if (link(GraphEdge.similarity(similarityEdgeCount, source, target, weight))) {
        similarityEdgeCount++;
      }
    }

    /** Ignored when the pair is already linked, as for similarity edges. */
    void addMembershipEdge(String source, String target, double weight) {
      if (link(GraphEdge.membership(membershipEdgeCount, source, target, weight))) {
        membershipEdgeCount++;
      }
    }

    private boolean link(GraphEdge edge) {
      if (!linkedPairs.add(edge.pairKey())) {
        return false;
      }
      edges.add(edge);
      return true;
    }

    KnowledgeGraph toGraph(int totalDocuments, KnowledgeGraphQuery query) {
      for (GraphEdge edge : edges) {
        if (!nodeIndex.containsKey(edge.source()) || !nodeIndex.containsKey(edge.target())) {
          throw new IllegalStateException(
              "Edge " + edge.id() + " references a node missing from the graph");
        }
      }
      List<GraphNode> nodes = List.copyOf(nodeIndex.values());
      GraphMeta meta =
          new GraphMeta(
              totalDocuments, query.threshold(), query.maxEdges(), nodes.size(), edges.size());
      return new KnowledgeGraph(nodes, List.copyOf(edges), meta);
    }
  }
}
