package anf;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import anf.parser.UnnestSyntaxException;

public class Main {

	static final int EXIT_OK = 0;
	static final int EXIT_SYNTAX_ERROR = 1;
	static final int EXIT_USAGE = 2;
	static final int EXIT_IO_ERROR = 3;

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	/**
	 * @param args input file and optional output file
	 * @return the process exit code
	 */
	static int run(String[] args, PrintStream out, PrintStream err) {
		if (args.length < 1 || args.length > 2) {
			err.println("1 or 2 parameters required.");
			err.println("parameter 1: input file");
			err.println("parameter 2 (optional): output file, default is standard output");
			return EXIT_USAGE;
		}
		Path inputFile = Paths.get(args[0]);
		try {
			String source = new String(Files.readAllBytes(inputFile), StandardCharsets.UTF_8);
			String result = Unnester.transform(source, inputFile.toString());
			if (args.length == 2) {
				Files.write(Paths.get(args[1]), result.getBytes(StandardCharsets.UTF_8));
			} else {
				out.print(result);
			}
			return EXIT_OK;
		} catch (UnnestSyntaxException e) {
			for (String error : e.getErrors()) {
				err.println(inputFile + ": " + error);
			}
			return EXIT_SYNTAX_ERROR;
		} catch (IOException e) {
			err.println(e.getMessage());
			return EXIT_IO_ERROR;
		}
	}

}
