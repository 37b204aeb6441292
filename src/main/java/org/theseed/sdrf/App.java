package org.theseed.sdrf;

import java.util.Arrays;

import org.theseed.sdrf.utils.BaseProcessor;

/**
 * Commands for SDRF metadata tables
 *
 * convert		convert a metadata file between SDRF and workbook format
 * reorder		rewrite a metadata file with its columns in section order
 * pools		list the pools of a metadata file
 * bulk			export a directory of metadata files to a ZIP archive
 * combine		combine several metadata files into one
 *
 * @author Bruce Parrello
 *
 */
public class App
{
    public static void main( String[] args )
    {
        if (args.length < 1) {
            System.err.println("Usage: App <command> [options]; commands are convert, reorder, pools, bulk, combine.");
            System.exit(1);
        }
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "convert" :
            processor = new ConvertProcessor();
            break;
        case "reorder" :
            processor = new ReorderProcessor();
            break;
        case "pools" :
            processor = new PoolReportProcessor();
            break;
        case "bulk" :
            processor = new BulkExportProcessor();
            break;
        case "combine" :
            processor = new CombineProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
            if (! processor.isSuccessful())
                System.exit(1);
        }
    }
}
