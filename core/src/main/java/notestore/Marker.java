package notestore;

/**
 * Weld SE scans recursively from the package of this class to find beans across every module on the classpath.
 */
public class Marker {
}
