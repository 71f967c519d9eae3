package clashsub;

/**
 * Subscription conversion server.
 * Turns a Clash subscription URL into a grouped, load-balanced client configuration.
 */
public class ClashSub extends SubscriptionProxy {

    public ClashSub(RuntimeConfig runtime) {
        super(
            runtime.port,
            httpFetcher(runtime.fetch),
            new SubscriptionConverter(runtime.converter),
            runtime.fetch.forwardHeaders
        );
    }

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : Constants.CONFIG_FILE;
        RuntimeConfig runtime = ConfigLoader.load(configPath);
        if (runtime == null) {
            Logger.error("Failed to initialize configuration");
            System.exit(1);
        }

        ClashSub server = new ClashSub(runtime);
        server.start();

        Logger.info("Subscription converter running on port " + server.getPort());
    }
}
