package clashsub;

import java.util.List;

/**
 * Strategy deciding which group each node belongs to.
 */
public interface NodeClassifier {

    /**
     * Classifies the named nodes. Nodes without a name are left out of the
     * result; everything else gets exactly one classification.
     *
     * @param nodes all nodes of the subscription, in input order
     * @return one entry per named node, in input order
     */
    List<ClassifiedNode> classify(List<ProxyNode> nodes);
}
