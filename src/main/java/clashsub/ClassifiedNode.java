package clashsub;

/**
 * A named node together with its classification.
 */
public record ClassifiedNode(ProxyNode node, Classification classification) {

    public String name() {
        return node.name();
    }
}
