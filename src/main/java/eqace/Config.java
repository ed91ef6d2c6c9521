package eqace;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

import eqace.lexer.Notation;

/**
 * Engine settings, read from {@value #configFile} in the working directory if it exists.
 */
public class Config {

	public static final Logger LOG = Logger.getLogger("Config");

	public static final String configFile = "eqace.ini";

	private static final Map<String, String> defaults = new HashMap<String, String>(){{
		put("notation", "asciimath");
		put("mirror", "no");
		put("nearTextLength", "5");
		put("maxDepth", "500");
	}};

	private static final Map<String, String> config = new HashMap<>(defaults);

	/** Notation used when the caller doesn't pick one */
	public static Notation getNotation(){
		return Notation.forName(config.get("notation"));
	}

	/** Start derivations with mirroring enabled? */
	public static boolean mirrorByDefault(){
		return config.get("mirror").equals("yes");
	}

	/** Maximum length of the input slice reported with parse errors */
	public static int getNearTextLength(){
		return getNonNegativeInt("nearTextLength");
	}

	/** Maximum nesting of parentheses, signs and powers the parser accepts */
	public static int getMaxDepth(){
		return getNonNegativeInt("maxDepth");
	}

	private static int getNonNegativeInt(String key){
		try {
			return Math.max(0, Integer.parseInt(config.get(key).trim()));
		} catch (NumberFormatException e) {
			LOG.warning("Invalid " + key + " \"" + config.get(key) + "\", using default");
			return Integer.parseInt(defaults.get(key));
		}
	}

	public static void set(String key, String value){
		if (!defaults.containsKey(key)){
			throw new EquationException(String.format("Unknown config key \"%s\"", key));
		}
		config.put(key, value);
	}

	public static void reset(){
		config.clear();
		config.putAll(defaults);
	}

	/**
	 * Loads the passed file on top of the current settings. Lines have the form {@code key = value},
	 * other lines are ignored.
	 */
	public static void load(Path file) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					String key = parts[0].trim();
					if (defaults.containsKey(key)){
						config.put(key, parts[1].trim());
					} else {
						LOG.warning("Unknown config key \"" + key + "\"");
					}
				}
			}
		}
	}

	private static void loadConfig(){
		Path file = Paths.get(configFile);
		if (Files.exists(file)){
			try {
				load(file);
			} catch (IOException e) {
				LOG.warning("Can't read " + configFile + ": " + e.getMessage());
			}
		}
	}

	static {
		loadConfig();
	}
}
