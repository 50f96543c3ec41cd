package ee.taltech.assetregistry.cli;

import ee.taltech.assetregistry.access.AccessControlService;
import ee.taltech.assetregistry.access.AccessStatus;
import ee.taltech.assetregistry.access.AssetInfo;
import ee.taltech.assetregistry.assets.AssetStore;
import ee.taltech.assetregistry.auth.Session;
import ee.taltech.assetregistry.chain.LocalBlockHeightProvider;
import ee.taltech.assetregistry.error.RegistryException;
import ee.taltech.assetregistry.log.LoggerService;
import ee.taltech.assetregistry.registry.RegistryService;
import ee.taltech.assetregistry.registry.RegistryStatistics;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Scanner;

@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@ConditionalOnProperty(name = "assetregistry.cli.enabled", havingValue = "true", matchIfMissing = true)
public class Cli implements CommandLineRunner {

    private final AssetStore assetStore;
    private final AccessControlService accessControl;
    private final RegistryService registryService;
    private final LocalBlockHeightProvider blockHeight;
    private final LoggerService logger;
    private Scanner scannerSingleton;

    public Cli(AssetStore assetStore,
               AccessControlService accessControl,
               RegistryService registryService,
               LocalBlockHeightProvider blockHeight,
               LoggerService logger) {
        this.assetStore = assetStore;
        this.accessControl = accessControl;
        this.registryService = registryService;
        this.blockHeight = blockHeight;
        this.logger = logger;
    }

    @Override
    public void run(String... args) {
        scannerSingleton = new Scanner(System.in);

        // Ensure DB is up before anything else
        waitForDatabase();

        while (true) {
            System.out.println("\n=======---- asset registry ----=======");
            System.out.println("1. Act as principal");
            System.out.println("2. Registry statistics");
            System.out.println("0. Exit");
            System.out.println("===========----------------===========");
            System.out.print("> ");

            String choice;
            try {
                choice = scannerSingleton.nextLine().trim();
            } catch (Exception e) {
                // stdin closed or broken
                return;
            }

            try {
                switch (choice) {
                    case "1" -> {
                        Session session = selectPrincipal();
                        if (session != null) assetMenu(session);
                    }
                    case "2" -> showStatistics();
                    case "0" -> {
                        System.out.println("Bye.");
                        return;
                    }
                    default -> System.out.println("Invalid option.");
                }
            } catch (Exception e) {
                // Do not leak stack traces or DB details
                System.out.println("Database error.");
                waitForDatabase();
            }
        }
    }

    // ------------------------------ principal -----------------------------------

    private Session selectPrincipal() {
        System.out.print("Principal: ");
        String principal = scannerSingleton.nextLine().trim();

        if (principal.isEmpty()) {
            System.out.println("Canceled.");
            return null;
        }
        return new Session(principal);
    }

    // ------------------------ asset operations menu ---------------------------

    private void assetMenu(Session session) {
        System.out.println("\nActing as: " + session.principal());

        while (true) {
            System.out.println("\n==========-- asset operations --==========");
            System.out.println("1. Create asset");
            System.out.println("2. Update asset");
            System.out.println("3. Transfer ownership");
            System.out.println("4. Delete asset");
            System.out.println("5. Show asset");
            System.out.println("6. Verify access status");
            System.out.println("7. Show owner");
            System.out.println("0. Back");
            System.out.println("press 'enter' at an empty input to cancel");
            System.out.println("===========--------------------===========");
            System.out.print("> ");

            String choice = scannerSingleton.nextLine().trim();
            if (choice.equals("0")) {
                return;
            }

            try {
                switch (choice) {
                    case "1" -> createMenu(session);
                    case "2" -> updateMenu(session);
                    case "3" -> transferMenu(session);
                    case "4" -> deleteMenu(session);
                    case "5" -> showAsset(session);
                    case "6" -> verifyAccess();
                    case "7" -> showOwner();
                    default -> {
                        System.out.println("Invalid option.");
                        continue;
                    }
                }
            } catch (RegistryException e) {
                System.out.println("Error: " + e.error() + " (" + e.getMessage() + ")");
            } catch (NumberFormatException e) {
                System.out.println("Error: expected a number.");
            }
            // every submitted command lands in its own block
            blockHeight.advance();
        }
    }

    // ---------------------- asset operations helpers --------------------------

    private void createMenu(Session session) {
        AssetInput input = readAssetInput();
        if (input == null) return;

        long id = assetStore.createDigitalAsset(session, input.name(), input.sizeBytes(),
                input.description(), input.tags());
        System.out.println("Asset created with id " + id + ".");
    }

    private void updateMenu(Session session) {
        Long assetId = readAssetId();
        if (assetId == null) return;

        AssetInput input = readAssetInput();
        if (input == null) return;

        assetStore.updateDigitalAsset(session, assetId, input.name(), input.sizeBytes(),
                input.description(), input.tags());
        System.out.println("Asset updated.");
    }

    private void transferMenu(Session session) {
        Long assetId = readAssetId();
        if (assetId == null) return;

        String newOwner = prompt("New owner: ");
        if (newOwner == null) return;

        assetStore.transferAssetOwnership(session, assetId, newOwner);
        System.out.println("Ownership transferred to " + newOwner + ".");
    }

    private void deleteMenu(Session session) {
        Long assetId = readAssetId();
        if (assetId == null) return;

        if (!assetStore.assetExists(assetId)) {
            System.out.println("No such asset.");
            return;
        }

        String confirm = prompt("Type 'delete' to confirm: ");
        if (!"delete".equals(confirm)) {
            System.out.println("Canceled.");
            return;
        }

        assetStore.deleteDigitalAsset(session, assetId);
        System.out.println("Asset deleted.");
    }

    private void showAsset(Session session) {
        Long assetId = readAssetId();
        if (assetId == null) return;

        AssetInfo info = accessControl.getAssetInformation(session, assetId);
        System.out.println("id:          " + info.assetId());
        System.out.println("name:        " + info.name());
        System.out.println("owner:       " + info.owner());
        System.out.println("size_bytes:  " + info.sizeBytes());
        System.out.println("created_at:  " + info.createdAt());
        System.out.println("description: " + info.description());
        System.out.println("tags:        " + String.join(", ", info.tags()));
    }

    private void verifyAccess() {
        Long assetId = readAssetId();
        if (assetId == null) return;

        String principal = prompt("Principal to check: ");
        if (principal == null) return;

        AccessStatus status = accessControl.verifyAccessStatus(assetId, principal);
        System.out.println("granted: " + status.hasGrantedAccess()
                + "  owner: " + status.isAssetOwner()
                + "  can read: " + status.canReadAsset());
    }

    private void showOwner() {
        Long assetId = readAssetId();
        if (assetId == null) return;

        System.out.println("Owner: " + accessControl.getAssetOwner(assetId));
    }

    private void showStatistics() {
        RegistryStatistics stats = registryService.getRegistryStatistics();
        System.out.println("Assets registered:    " + stats.totalAssetsRegistered());
        System.out.println("System administrator: " + stats.systemAdministrator());
        System.out.println("Current block:        " + blockHeight.currentHeight());
    }

    // ------------------------------ input ------------------------------

    private AssetInput readAssetInput() {
        String name = prompt("Name: ");
        if (name == null) return null;

        String size = prompt("Size in bytes: ");
        if (size == null) return null;

        String description = prompt("Description: ");
        if (description == null) return null;

        String tags = prompt("Tags (comma separated): ");
        if (tags == null) return null;

        List<String> tagList = Arrays.stream(tags.split(","))
                .map(String::trim)
                .toList();

        return new AssetInput(name, Long.parseLong(size), description, tagList);
    }

    private Long readAssetId() {
        String raw = prompt("Asset id: ");
        return raw == null ? null : Long.parseLong(raw);
    }

    private String prompt(String label) {
        System.out.print(label);
        String value = scannerSingleton.nextLine().trim();
        if (value.isEmpty()) {
            System.out.println("Canceled.");
            return null;
        }
        return value;
    }

    private record AssetInput(String name, long sizeBytes, String description, List<String> tags) {
    }

    private void waitForDatabase() {
        while (true) {
            try {
                registryService.healthCheck();   // lightweight query
                return; // DB is healthy, continue
            } catch (Exception e) {
                logger.log("db_unreachable", null, "error=" + e.getClass().getSimpleName());
                System.out.println("Database unavailable. Retrying...");
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
