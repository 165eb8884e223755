package gll;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global defaults of the parser options.
 *
 * The defaults can be overridden by a {@value #configFile} file in the working directory
 * (lines of the form {@code key = value}) and by system properties of the form {@code gll.key}.
 */
public class Config {

	public static final String configFile = "gll.ini";

	private static final Logger LOG = Logger.getLogger("GLL");

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("lookahead", "yes");
		put("retainGraphs", "no");
		put("maxDescriptors", "0");
		put("maxGssNodes", "0");
		put("maxSppfNodes", "0");
	}};

	/** Skip alternatives whose lookahead set does not contain the current token? */
	public static boolean useLookahead(){
		return getBoolean("lookahead");
	}

	/** Keep the stack and the forest builder in the parse result (for debugging and graph export)? */
	public static boolean retainGraphs(){
		return getBoolean("retainGraphs");
	}

	/** Maximum number of descriptors per parse, 0 for no limit */
	public static int maxDescriptors(){
		return getInt("maxDescriptors");
	}

	/** Maximum number of stack nodes per parse, 0 for no limit */
	public static int maxGssNodes(){
		return getInt("maxGssNodes");
	}

	/** Maximum number of forest nodes (packed nodes included) per parse, 0 for no limit */
	public static int maxSppfNodes(){
		return getInt("maxSppfNodes");
	}

	public static String get(String key){
		String value = System.getProperty("gll." + key);
		if (value != null){
			return value.trim();
		}
		if (!config.containsKey(key)){
			throw new GLLException(String.format("Unknown config key \"%s\"", key));
		}
		return config.get(key);
	}

	private static boolean getBoolean(String key){
		String value = get(key);
		return value.equals("yes") || value.equals("true");
	}

	private static int getInt(String key){
		String value = get(key);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException ex){
			throw new GLLException(String.format("Config key \"%s\" expects an integer, got \"%s\"", key, value), ex);
		}
	}

	private static void loadConfig(){
		File file = new File(configFile);
		if (!file.exists()){
			return;
		}
		try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					if (config.containsKey(parts[0].trim())){
						config.put(parts[0].trim(), parts[1].trim());
					} else {
						LOG.warning("Unknown config key \"" + parts[0] + "\" in " + configFile);
					}
				}
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Cannot read " + configFile + ", using defaults", e);
		}
	}

	static {
		loadConfig();
	}
}
