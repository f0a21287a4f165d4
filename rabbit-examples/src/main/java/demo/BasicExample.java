package demo;

import org.burrow.rabbit.publisher.RabbitPublisher;
import org.burrow.rabbit.registry.RabbitManager;

import java.nio.file.Path;

/**
 * Simplest setup: YAML config and a main method.
 *
 * Run: java -cp "lib/*" demo.BasicExample burrow.yml
 */
public class BasicExample {

    public static void main(String[] args) throws InterruptedException {
        // 1. Load config and create the manager
        var manager = args.length > 0
                ? RabbitManager.fromYaml(Path.of(args[0]))
                : RabbitManager.fromClasspath("burrow.yml");

        // 2. Register a consumer and a publisher by their configured names
        manager.consumer("tracks", Track.class, BasicExample::onTrack);
        RabbitPublisher<Track> tracks = manager.publisher("tracks", Track.class);

        // 3. Start (consumers connect and subscribe, the queue worker starts draining)
        manager.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down...");
            manager.close();
        }));

        // 4. Publish a few messages; they are queued and sent in order
        tracks.publish(new Track("Porter Robinson", "Shelter"));
        tracks.publish(new Track("Porter Robinson", "Language"));
        tracks.publish(new Track("Madeon", "Pop Culture"));

        System.out.println("Listening on TestQueue... (Ctrl+C to stop)");
        Thread.currentThread().join();
    }

    private static boolean onTrack(Track track) {
        System.out.printf("%-16s %s%n", track.artist(), track.title());
        return true;
    }
}
